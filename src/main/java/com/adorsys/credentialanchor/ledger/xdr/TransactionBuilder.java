package com.adorsys.credentialanchor.ledger.xdr;

import com.adorsys.credentialanchor.ledger.AccountState;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds a transaction for the next sequence number of the given account. The fee is the base
 * fee times the number of operations.
 */
public class TransactionBuilder {

    private static final int MAX_OPERATIONS = 100;

    private final AccountState account;
    private final long baseFee;
    private final List<Operation> operations = new ArrayList<>();
    private MemoText memo = MemoText.of("");
    private Duration timeout = Duration.ofSeconds(300);
    private Clock clock = Clock.systemUTC();

    public TransactionBuilder(AccountState account, long baseFee) {
        this.account = account;
        this.baseFee = baseFee;
    }

    public TransactionBuilder addOperation(Operation operation) {
        if (operations.size() == MAX_OPERATIONS) {
            throw new IllegalStateException("A transaction holds at most " + MAX_OPERATIONS + " operations");
        }
        operations.add(operation);
        return this;
    }

    public TransactionBuilder setMemo(MemoText memo) {
        this.memo = memo;
        return this;
    }

    public TransactionBuilder setTimeout(Duration timeout) {
        this.timeout = timeout;
        return this;
    }

    public TransactionBuilder setClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    public Transaction build() {
        if (operations.isEmpty()) {
            throw new IllegalStateException("A transaction needs at least one operation");
        }
        long maxTime = clock.instant().plus(timeout).getEpochSecond();
        return new Transaction(account.getAccountId(), baseFee * operations.size(), account.getSequence() + 1,
                0L, maxTime, memo, operations);
    }
}
