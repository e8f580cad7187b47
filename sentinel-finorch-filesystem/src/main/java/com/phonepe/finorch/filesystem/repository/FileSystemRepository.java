/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.finorch.filesystem.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import com.phonepe.finorch.core.errors.ErrorType;
import com.phonepe.finorch.core.errors.FinOrchError;
import com.phonepe.finorch.core.errors.PersistenceException;
import com.phonepe.finorch.core.model.Account;
import com.phonepe.finorch.core.model.AdvisoryEnrollment;
import com.phonepe.finorch.core.model.Card;
import com.phonepe.finorch.core.model.CardPayment;
import com.phonepe.finorch.core.model.CardTransaction;
import com.phonepe.finorch.core.model.Holding;
import com.phonepe.finorch.core.model.InvestmentTransaction;
import com.phonepe.finorch.core.model.Payee;
import com.phonepe.finorch.core.model.SipPlan;
import com.phonepe.finorch.core.model.TransactionRecord;
import com.phonepe.finorch.core.repository.Repository;
import com.phonepe.finorch.core.setup.OrchestratorSetup;
import com.phonepe.finorch.core.utils.JsonUtils;
import com.phonepe.finorch.filesystem.utils.FileUtils;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.function.Supplier;

/**
 * Repository backed by JSON files, one directory per user:
 * <pre>
 * users/&lt;user_id&gt;/accounts.json
 *                   payees.json
 *                   cards.json
 *                   card_payments.json
 *                   card_transactions.json
 *                   holdings.json
 *                   investment_transactions.json
 *                   sip_plans.json
 *                   advisory.json
 *                   transactions/&lt;account_id&gt;.json
 *                   journal/&lt;transfer_id&gt;.json
 * </pre>
 * Reads and writes for one user are coordinated by a per-user read/write lock. Transfer commits are journaled.
 * Entries left behind by a crash or a failed roll back are resolved when the repository is created, and before
 * any further commit for the same user.
 */
@Slf4j
public class FileSystemRepository implements Repository {
    private static final String USERS_DIR = "users";
    private static final String ACCOUNTS_FILE = "accounts.json";
    private static final String PAYEES_FILE = "payees.json";
    private static final String CARDS_FILE = "cards.json";
    private static final String CARD_PAYMENTS_FILE = "card_payments.json";
    private static final String CARD_TRANSACTIONS_FILE = "card_transactions.json";
    private static final String HOLDINGS_FILE = "holdings.json";
    private static final String INVESTMENT_TRANSACTIONS_FILE = "investment_transactions.json";
    private static final String SIP_PLANS_FILE = "sip_plans.json";
    private static final String ADVISORY_FILE = "advisory.json";
    private static final String TRANSACTIONS_DIR = "transactions";
    private static final String JOURNAL_DIR = "journal";
    private static final String JSON_SUFFIX = ".json";

    private static final TypeReference<List<Account>> ACCOUNTS = new TypeReference<>() {};
    private static final TypeReference<List<Payee>> PAYEES = new TypeReference<>() {};
    private static final TypeReference<List<TransactionRecord>> TRANSACTIONS = new TypeReference<>() {};
    private static final TypeReference<List<Card>> CARDS = new TypeReference<>() {};
    private static final TypeReference<List<CardPayment>> CARD_PAYMENTS = new TypeReference<>() {};
    private static final TypeReference<List<CardTransaction>> CARD_TRANSACTIONS = new TypeReference<>() {};
    private static final TypeReference<List<Holding>> HOLDINGS = new TypeReference<>() {};
    private static final TypeReference<List<InvestmentTransaction>> INVESTMENT_TRANSACTIONS =
            new TypeReference<>() {};
    private static final TypeReference<List<SipPlan>> SIP_PLANS = new TypeReference<>() {};

    private final Path usersRoot;
    private final ObjectMapper mapper;
    private final Striped<ReadWriteLock> userLocks;

    public FileSystemRepository(@NonNull String dataDir, ObjectMapper mapper) {
        this(dataDir, mapper, OrchestratorSetup.DEFAULT_LOCK_STRIPES);
    }

    public FileSystemRepository(@NonNull String dataDir, ObjectMapper mapper, int lockStripes) {
        this.usersRoot = FileUtils.ensurePath(Path.of(dataDir, USERS_DIR).toString(), true);
        this.mapper = Objects.requireNonNullElseGet(mapper, JsonUtils::createMapper);
        this.userLocks = Striped.readWriteLock(lockStripes > 0 ? lockStripes : OrchestratorSetup.DEFAULT_LOCK_STRIPES);
        recoverPendingCommits();
    }

    @Override
    public boolean userExists(String userId) {
        return FileUtils.isSafeName(userId)
                && read(userId, () -> Files.isDirectory(userDir(userId), LinkOption.NOFOLLOW_LINKS));
    }

    @Override
    public boolean hasAccountsRecord(String userId) {
        return FileUtils.isSafeName(userId)
                && read(userId, () -> Files.isRegularFile(userDir(userId).resolve(ACCOUNTS_FILE)));
    }

    @Override
    public List<Account> listAccounts(String userId) {
        return readList(userId, ACCOUNTS_FILE, ACCOUNTS);
    }

    @Override
    public List<Payee> listPayees(String userId) {
        return readList(userId, PAYEES_FILE, PAYEES);
    }

    @Override
    public List<TransactionRecord> listTransactions(String userId, String accountId) {
        if (!FileUtils.isSafeName(accountId)) {
            return List.of();
        }
        return readList(userId, Path.of(TRANSACTIONS_DIR, accountId + JSON_SUFFIX).toString(), TRANSACTIONS);
    }

    @Override
    public void appendTransaction(String userId, String accountId, TransactionRecord record) {
        final var transactionsFile = transactionsFile(existingUserDir(userId), accountId);
        write(userId, () -> {
            final var records = new ArrayList<TransactionRecord>();
            records.add(record);
            records.addAll(readFile(transactionsFile, TRANSACTIONS).orElse(List.of()));
            writeJson(transactionsFile, records);
            return null;
        });
    }

    @Override
    public void updateAccount(String userId, Account account) {
        final var accountsFile = existingUserDir(userId).resolve(ACCOUNTS_FILE);
        write(userId, () -> {
            writeJson(accountsFile, replaceAccount(userId, readFile(accountsFile, ACCOUNTS).orElse(List.of()),
                                                   account));
            return null;
        });
    }

    /**
     * Commits a transfer through the user's journal. Refused while an earlier entry for the same user is still
     * pending: that entry is resolved first and the caller has to retry against the resolved state.
     */
    @Override
    public void commitTransfer(String userId, Account updatedAccount, TransactionRecord record) {
        final var userDir = existingUserDir(userId);
        final var accountsFile = userDir.resolve(ACCOUNTS_FILE);
        final var transactionsFile = transactionsFile(userDir, updatedAccount.getAccountId());
        if (!FileUtils.isSafeName(record.getId())) {
            throw new PersistenceException("Transaction id is not usable as a journal name: " + record.getId());
        }
        final var journalFile = userDir.resolve(JOURNAL_DIR).resolve(record.getId() + JSON_SUFFIX);
        write(userId, () -> {
            if (resolvePending(userId, userDir) > 0) {
                throw new PersistenceException("Transfer %s refused, pending commits of user %s were just resolved"
                                                       .formatted(record.getId(), userId));
            }
            final var currentAccounts = readFile(accountsFile, ACCOUNTS).orElse(List.of());
            //Validates the account exists before anything is written
            final var accounts = replaceAccount(userId, currentAccounts, updatedAccount);
            final var previousAccounts = readBytes(accountsFile);
            final var previousTransactions = readBytes(transactionsFile);
            final var entry = JournalEntry.builder()
                    .transferId(record.getId())
                    .userId(userId)
                    .previousAccount(findAccount(currentAccounts, updatedAccount.getAccountId()).orElse(null))
                    .account(updatedAccount)
                    .record(record)
                    .status(JournalEntry.Status.COMMITTING)
                    .createdAt(System.currentTimeMillis())
                    .build();
            try {
                writeFile(journalFile, mapper.writeValueAsBytes(entry));
                writeJson(transactionsFile, prepend(readFile(transactionsFile, TRANSACTIONS).orElse(List.of()),
                                                    record));
                writeJson(accountsFile, accounts);
                Files.deleteIfExists(journalFile);
            }
            catch (IOException | RuntimeException e) {
                throw rollback(entry, e, journalFile, accountsFile, previousAccounts,
                               transactionsFile, previousTransactions);
            }
            log.debug("Committed transfer {} to files of user {}", record.getId(), userId);
            return null;
        });
    }

    @Override
    public List<Card> listCards(String userId) {
        return readList(userId, CARDS_FILE, CARDS);
    }

    @Override
    public List<CardPayment> listCardPayments(String userId) {
        return readList(userId, CARD_PAYMENTS_FILE, CARD_PAYMENTS);
    }

    @Override
    public List<CardTransaction> listCardTransactions(String userId) {
        return readList(userId, CARD_TRANSACTIONS_FILE, CARD_TRANSACTIONS);
    }

    @Override
    public List<Holding> listHoldings(String userId) {
        return readList(userId, HOLDINGS_FILE, HOLDINGS);
    }

    @Override
    public List<InvestmentTransaction> listInvestmentTransactions(String userId) {
        return readList(userId, INVESTMENT_TRANSACTIONS_FILE, INVESTMENT_TRANSACTIONS);
    }

    @Override
    public List<SipPlan> listSipPlans(String userId) {
        return readList(userId, SIP_PLANS_FILE, SIP_PLANS);
    }

    @Override
    public Optional<AdvisoryEnrollment> advisoryEnrollment(String userId) {
        if (!FileUtils.isSafeName(userId)) {
            return Optional.empty();
        }
        final var file = userDir(userId).resolve(ADVISORY_FILE);
        return read(userId, () -> readFile(file, AdvisoryEnrollment.class));
    }

    /**
     * Single file write used for every change. Overridable so that tests can inject failures.
     */
    @VisibleForTesting
    protected void writeFile(Path file, byte[] data) throws IOException {
        FileUtils.writeAtomically(file, data);
    }

    /**
     * Puts back the contents a file had before a failed commit. Overridable so that tests can inject failures.
     */
    @VisibleForTesting
    protected void restoreFile(Path file, byte[] previousContents) throws IOException {
        FileUtils.restore(file, previousContents);
    }

    /**
     * Resolves every journal entry found on disk. See {@link #resolve(String, Path, Path)} for what is done with
     * each entry.
     */
    @VisibleForTesting
    void recoverPendingCommits() {
        final List<Path> userDirs;
        try (final var dirs = Files.list(usersRoot)) {
            userDirs = dirs.filter(Files::isDirectory).toList();
        }
        catch (IOException e) {
            throw new PersistenceException("Could not scan user directories under " + usersRoot, e);
        }
        for (final var userDir : userDirs) {
            final var userId = userDir.getFileName().toString();
            if (!FileUtils.isSafeName(userId)) {
                log.warn("Skipping journal recovery for unexpected directory {}", userDir);
                continue;
            }
            write(userId, () -> resolvePending(userId, userDir));
        }
    }

    /**
     * Resolves the pending journal entries of one user. Caller holds the user's write lock.
     *
     * @return number of entries resolved
     */
    private int resolvePending(String userId, Path userDir) {
        final var journalDir = userDir.resolve(JOURNAL_DIR);
        if (!Files.isDirectory(journalDir)) {
            return 0;
        }
        final List<Path> entries;
        try (final var files = Files.list(journalDir)) {
            entries = files.filter(file -> file.getFileName().toString().endsWith(JSON_SUFFIX))
                    .sorted()
                    .toList();
        }
        catch (IOException e) {
            throw new PersistenceException("Could not scan journal " + journalDir, e);
        }
        entries.forEach(journalFile -> resolve(userId, userDir, journalFile));
        return entries.size();
    }

    /**
     * Resolves one journal entry.
     * <ul>
     *     <li>Rolling back: the record is removed and the account row is put back, if it still shows the
     *     transfer</li>
     *     <li>Committing: applied only while the account row still matches the row the transfer was computed
     *     from, or already shows the transfer. Any other row means the account moved on and the entry is
     *     discarded.</li>
     * </ul>
     */
    private void resolve(String userId, Path userDir, Path journalFile) {
        final var entry = readFile(journalFile, JournalEntry.class)
                .orElseThrow(() -> new PersistenceException("Journal entry vanished: " + journalFile));
        final var accountsFile = userDir.resolve(ACCOUNTS_FILE);
        final var transactionsFile = transactionsFile(userDir, entry.getAccount().getAccountId());
        final var accounts = readFile(accountsFile, ACCOUNTS).orElse(List.of());
        final var records = readFile(transactionsFile, TRANSACTIONS).orElse(List.of());
        final var current = findAccount(accounts, entry.getAccount().getAccountId()).orElse(null);
        final var applied = sameRow(current, entry.getAccount());
        final var recorded = records.stream()
                .anyMatch(existing -> Objects.equals(existing.getId(), entry.getRecord().getId()));
        try {
            if (entry.isRollingBack()) {
                if (recorded) {
                    writeJson(transactionsFile, without(records, entry.getRecord().getId()));
                }
                if (applied && entry.getPreviousAccount() != null) {
                    writeJson(accountsFile, replaceAccount(userId, accounts, entry.getPreviousAccount()));
                }
                log.info("Rolled back failed transfer {} for user {}", entry.getTransferId(), userId);
            }
            else if (applied || entry.getPreviousAccount() == null
                    || sameRow(current, entry.getPreviousAccount())) {
                if (!recorded) {
                    writeJson(transactionsFile, prepend(records, entry.getRecord()));
                }
                if (!applied) {
                    writeJson(accountsFile, replaceAccount(userId, accounts, entry.getAccount()));
                }
                log.info("Recovered pending transfer {} for user {}", entry.getTransferId(), userId);
            }
            else {
                if (recorded) {
                    writeJson(transactionsFile, without(records, entry.getRecord().getId()));
                }
                log.warn("Discarding pending transfer {} for user {}, account {} changed since it was journaled",
                         entry.getTransferId(), userId, entry.getAccount().getAccountId());
            }
            Files.deleteIfExists(journalFile);
        }
        catch (IOException e) {
            throw new PersistenceException("Could not resolve journal entry " + journalFile, e);
        }
    }

    /**
     * Restores the files a failed commit touched. When they cannot be restored the journal entry is marked for
     * roll back, so that recovery undoes the transfer the caller was told had failed. If even that mark cannot be
     * written the entry still says committing and recovery will apply it, which the returned error says.
     */
    private PersistenceException rollback(
            JournalEntry entry,
            Exception failure,
            Path journalFile,
            Path accountsFile,
            byte[] previousAccounts,
            Path transactionsFile,
            byte[] previousTransactions) {
        final var transferId = entry.getTransferId();
        final var userId = entry.getUserId();
        log.error("Commit of transfer {} for user {} failed, restoring previous files", transferId, userId, failure);
        try {
            restoreFile(transactionsFile, previousTransactions);
            restoreFile(accountsFile, previousAccounts);
            Files.deleteIfExists(journalFile);
            return new PersistenceException("Could not commit transfer " + transferId, failure);
        }
        catch (IOException e) {
            log.error("Could not restore files for transfer {} of user {}", transferId, userId, e);
            failure.addSuppressed(e);
        }
        try {
            writeFile(journalFile, mapper.writeValueAsBytes(entry.withStatus(JournalEntry.Status.ROLLING_BACK)));
            return new PersistenceException("Could not commit transfer %s, it will be rolled back on recovery"
                                                    .formatted(transferId), failure);
        }
        catch (IOException e) {
            log.error("Could not mark transfer {} of user {} for roll back", transferId, userId, e);
            failure.addSuppressed(e);
            return new PersistenceException(FinOrchError.error(ErrorType.COMMIT_PENDING, transferId), failure);
        }
    }

    private <T> List<T> readList(String userId, String relativePath, TypeReference<List<T>> type) {
        if (!FileUtils.isSafeName(userId)) {
            return List.of();
        }
        final var file = userDir(userId).resolve(relativePath);
        return read(userId, () -> readFile(file, type).map(List::copyOf).orElse(List.of()));
    }

    private <T> Optional<T> readFile(Path file, TypeReference<T> type) {
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        }
        catch (IOException e) {
            throw new PersistenceException("Could not read " + file, e);
        }
    }

    private <T> Optional<T> readFile(Path file, Class<T> type) {
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), type));
        }
        catch (IOException e) {
            throw new PersistenceException("Could not read " + file, e);
        }
    }

    private static byte[] readBytes(Path file) {
        try {
            return FileUtils.readIfExists(file).orElse(null);
        }
        catch (IOException e) {
            throw new PersistenceException("Could not read " + file, e);
        }
    }

    private void writeJson(Path file, Object value) throws IOException {
        writeFile(file, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value));
    }

    private Path userDir(String userId) {
        return usersRoot.resolve(userId);
    }

    private Path existingUserDir(String userId) {
        if (!FileUtils.isSafeName(userId) || !Files.isDirectory(userDir(userId))) {
            throw new PersistenceException("No records exist for user " + userId);
        }
        return userDir(userId);
    }

    private static Path transactionsFile(Path userDir, String accountId) {
        if (!FileUtils.isSafeName(accountId)) {
            throw new PersistenceException("Account id is not usable as a file name: " + accountId);
        }
        return userDir.resolve(TRANSACTIONS_DIR).resolve(accountId + JSON_SUFFIX);
    }

    private static List<TransactionRecord> prepend(List<TransactionRecord> records, TransactionRecord record) {
        final var updated = new ArrayList<TransactionRecord>(records.size() + 1);
        updated.add(record);
        updated.addAll(records);
        return updated;
    }

    private static List<TransactionRecord> without(List<TransactionRecord> records, String recordId) {
        return records.stream()
                .filter(existing -> !Objects.equals(existing.getId(), recordId))
                .toList();
    }

    private static Optional<Account> findAccount(List<Account> accounts, String accountId) {
        return accounts.stream()
                .filter(account -> Objects.equals(account.getAccountId(), accountId))
                .findFirst();
    }

    private static boolean sameRow(Account lhs, Account rhs) {
        if (lhs == null || rhs == null) {
            return false;
        }
        return Objects.equals(lhs.getAccountId(), rhs.getAccountId())
                && sameAmount(lhs.getBalance(), rhs.getBalance())
                && sameAmount(lhs.getAvailableBalance(), rhs.getAvailableBalance())
                && Objects.equals(lhs.getLastUpdated(), rhs.getLastUpdated());
    }

    private static boolean sameAmount(BigDecimal lhs, BigDecimal rhs) {
        return lhs == null ? rhs == null : rhs != null && lhs.compareTo(rhs) == 0;
    }

    private static List<Account> replaceAccount(String userId, List<Account> accounts, Account account) {
        final var updated = new ArrayList<>(accounts);
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getAccountId().equals(account.getAccountId())) {
                updated.set(i, account);
                return updated;
            }
        }
        throw new PersistenceException("Account %s does not exist for user %s"
                                               .formatted(account.getAccountId(), userId));
    }

    @FunctionalInterface
    private interface IOAction<T> {
        T run() throws IOException;
    }

    private <T> T read(String userId, Supplier<T> reader) {
        final var lock = userLocks.get(userId).readLock();
        lock.lock();
        try {
            return reader.get();
        }
        finally {
            lock.unlock();
        }
    }

    private <T> T write(String userId, IOAction<T> action) {
        final var lock = userLocks.get(userId).writeLock();
        lock.lock();
        try {
            return action.run();
        }
        catch (IOException e) {
            throw new PersistenceException("Could not write records of user " + userId, e);
        }
        finally {
            lock.unlock();
        }
    }
}
