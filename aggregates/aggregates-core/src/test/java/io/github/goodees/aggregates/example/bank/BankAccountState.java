package io.github.goodees.aggregates.example.bank;

/*-
 * #%L
 * aggregates-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

public final class BankAccountState {
    public enum Status {
        NEW, ACTIVE, CLOSED
    }

    public static final BankAccountState INITIAL = new BankAccountState(null, 0, Status.NEW);

    private final String accountNumber;
    private final long balance;
    private final Status status;

    BankAccountState(String accountNumber, long balance, Status status) {
        this.accountNumber = accountNumber;
        this.balance = balance;
        this.status = status;
    }

    public String getAccountNumber() {
        return accountNumber;
    }

    public long getBalance() {
        return balance;
    }

    public Status getStatus() {
        return status;
    }

    BankAccountState withBalance(long balance) {
        return new BankAccountState(accountNumber, balance, status);
    }

    BankAccountState withStatus(Status status) {
        return new BankAccountState(accountNumber, balance, status);
    }

    @Override
    public String toString() {
        return "BankAccountState[" + accountNumber + ", balance=" + balance + ", " + status + "]";
    }
}
