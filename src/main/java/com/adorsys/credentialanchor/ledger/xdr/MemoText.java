package com.adorsys.credentialanchor.ledger.xdr;

import java.nio.charset.StandardCharsets;

/**
 * Text memo attached to a transaction. Longer text is cut at the 28 byte ledger limit.
 */
public final class MemoText {

    public static final int MAX_LENGTH = 28;
    private static final int MEMO_TEXT = 1;

    private final String text;

    private MemoText(String text) {
        this.text = text;
    }

    public static MemoText of(String text) {
        byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_LENGTH) {
            return new MemoText(text);
        }
        // cut on a code point boundary so the memo stays valid UTF-8
        int end = text.length();
        while (text.substring(0, end).getBytes(StandardCharsets.UTF_8).length > MAX_LENGTH) {
            end = text.offsetByCodePoints(end, -1);
        }
        return new MemoText(text.substring(0, end));
    }

    public String getText() {
        return text;
    }

    void encode(XdrOutputStream xdr) {
        xdr.writeInt(MEMO_TEXT);
        xdr.writeString(text, MAX_LENGTH);
    }

    @Override
    public String toString() {
        return text;
    }
}
