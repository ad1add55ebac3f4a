package com.phillippitts.autoremediation.service.store;

import com.phillippitts.autoremediation.domain.ActionType;
import com.phillippitts.autoremediation.domain.ActionWindowEntry;
import com.phillippitts.autoremediation.domain.CircuitBreakerState;
import com.phillippitts.autoremediation.domain.FindingKind;
import com.phillippitts.autoremediation.domain.Incident;
import com.phillippitts.autoremediation.domain.IncidentStatus;
import com.phillippitts.autoremediation.domain.RemediationAction;
import com.phillippitts.autoremediation.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process {@link RemediationStateStore}.
 *
 * <p>Transactions run under the store's write lock, so read-modify-write sequences inside a
 * callback are serialized. Writes are staged in the transaction and applied only after the
 * callback returns and the staged incidents pass the one-ACTIVE-per-(service, kind) check.
 * After-commit hooks run once the lock has been released.
 *
 * <p>Action window entries older than {@link #WINDOW_RETENTION} are pruned on append.
 */
@Component
public class InMemoryRemediationStateStore implements RemediationStateStore {

    private static final Logger LOG = LogManager.getLogger(InMemoryRemediationStateStore.class);

    static final Duration WINDOW_RETENTION = Duration.ofHours(24);

    private final Clock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Long, Incident> incidents = new LinkedHashMap<>();
    private final Map<String, Long> activeIndex = new HashMap<>();
    private final Map<Long, RemediationAction> actions = new LinkedHashMap<>();
    private final Map<String, CircuitBreakerState> breakers = new LinkedHashMap<>();
    private final Map<String, Deque<ActionWindowEntry>> window = new HashMap<>();

    private final AtomicLong incidentSeq = new AtomicLong();
    private final AtomicLong actionSeq = new AtomicLong();

    public InMemoryRemediationStateStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<Incident> findIncident(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(incidents.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Incident> findActiveIncident(String service, FindingKind kind) {
        lock.readLock().lock();
        try {
            Long id = activeIndex.get(indexKey(service, kind));
            return id == null ? Optional.empty() : Optional.ofNullable(incidents.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Incident> findLatestEscalated(String service, FindingKind kind) {
        lock.readLock().lock();
        try {
            return incidents.values().stream()
                    .filter(i -> i.status() == IncidentStatus.ESCALATED)
                    .filter(i -> i.service().equals(service) && i.kind() == kind)
                    .max(Comparator.comparing(Incident::escalatedAt,
                            Comparator.nullsFirst(Comparator.naturalOrder())));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Incident> findIncidentsByStatus(String service, IncidentStatus status) {
        lock.readLock().lock();
        try {
            List<Incident> result = new ArrayList<>();
            for (Incident incident : incidents.values()) {
                if (incident.status() == status && (service == null || incident.service().equals(service))) {
                    result.add(incident);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<RemediationAction> findActions(long incidentId) {
        lock.readLock().lock();
        try {
            List<RemediationAction> result = new ArrayList<>();
            for (RemediationAction action : actions.values()) {
                if (action.incidentId() == incidentId) {
                    result.add(action);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<CircuitBreakerState> findBreakerState(String service) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(breakers.get(service));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<CircuitBreakerState> findBreakerStates() {
        lock.readLock().lock();
        try {
            return List.copyOf(breakers.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int countActionWindowEntries(String service, ActionType actionType, Instant since) {
        lock.readLock().lock();
        try {
            Deque<ActionWindowEntry> entries = window.get(windowKey(service, actionType));
            if (entries == null) {
                return 0;
            }
            int count = 0;
            for (ActionWindowEntry entry : entries) {
                if (!entry.timestamp().isBefore(since)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        Objects.requireNonNull(callback, "callback");
        StagedTransaction tx = new StagedTransaction();
        T result;
        lock.writeLock().lock();
        try {
            result = callback.doInTransaction(tx);
            tx.validate();
            tx.apply();
        } finally {
            tx.closed = true;
            lock.writeLock().unlock();
        }
        runAfterCommit(tx.hooks);
        return result;
    }

    private void runAfterCommit(List<Runnable> hooks) {
        for (Runnable hook : hooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                LOG.error("After-commit hook failed: {}", e.toString(), e);
            }
        }
    }

    private static String indexKey(String service, FindingKind kind) {
        return service + '|' + kind.code();
    }

    private static String windowKey(String service, ActionType actionType) {
        return service + '|' + actionType.code();
    }

    /** Write set of one transaction; only touched while the store's write lock is held. */
    private final class StagedTransaction implements StoreTransaction {

        private final Map<Long, Incident> stagedIncidents = new LinkedHashMap<>();
        private final List<RemediationAction> stagedActions = new ArrayList<>();
        private final Map<String, CircuitBreakerState> stagedBreakers = new LinkedHashMap<>();
        private final List<ActionWindowEntry> stagedEntries = new ArrayList<>();
        private final List<Runnable> hooks = new ArrayList<>();
        private boolean closed;

        @Override
        public Incident insertIncident(Incident incident) {
            ensureOpen();
            Objects.requireNonNull(incident, "incident");
            if (incident.id() != 0L) {
                throw new PersistenceException("Incident already has an id: " + incident.id());
            }
            Incident stored = incident.withId(incidentSeq.incrementAndGet());
            stagedIncidents.put(stored.id(), stored);
            return stored;
        }

        @Override
        public void updateIncident(Incident incident) {
            ensureOpen();
            Objects.requireNonNull(incident, "incident");
            if (!incidents.containsKey(incident.id()) && !stagedIncidents.containsKey(incident.id())) {
                throw new PersistenceException("Unknown incident id: " + incident.id());
            }
            stagedIncidents.put(incident.id(), incident);
        }

        @Override
        public RemediationAction insertAction(RemediationAction action) {
            ensureOpen();
            Objects.requireNonNull(action, "action");
            RemediationAction stored = action.withId(actionSeq.incrementAndGet());
            stagedActions.add(stored);
            return stored;
        }

        @Override
        public void saveBreakerState(CircuitBreakerState state) {
            ensureOpen();
            Objects.requireNonNull(state, "state");
            stagedBreakers.put(state.service(), state);
        }

        @Override
        public void appendActionWindowEntry(ActionWindowEntry entry) {
            ensureOpen();
            stagedEntries.add(Objects.requireNonNull(entry, "entry"));
        }

        @Override
        public CircuitBreakerState breakerState(String service) {
            ensureOpen();
            CircuitBreakerState staged = stagedBreakers.get(service);
            if (staged != null) {
                return staged;
            }
            CircuitBreakerState committed = breakers.get(service);
            return committed != null ? committed : CircuitBreakerState.closed(service);
        }

        @Override
        public void afterCommit(Runnable hook) {
            ensureOpen();
            hooks.add(Objects.requireNonNull(hook, "hook"));
        }

        private void ensureOpen() {
            if (closed) {
                throw new IllegalStateException("Transaction already completed");
            }
        }

        void validate() {
            Map<String, Long> index = new HashMap<>(activeIndex);
            for (Incident incident : stagedIncidents.values()) {
                String key = indexKey(incident.service(), incident.kind());
                if (Objects.equals(index.get(key), incident.id()) && !incident.isActive()) {
                    index.remove(key);
                }
            }
            for (Incident incident : stagedIncidents.values()) {
                if (!incident.isActive()) {
                    continue;
                }
                String key = indexKey(incident.service(), incident.kind());
                Long existing = index.putIfAbsent(key, incident.id());
                if (existing != null && existing != incident.id()) {
                    throw new PersistenceException("Incident " + existing + " is already ACTIVE for "
                            + incident.service() + '/' + incident.kind().code());
                }
            }
        }

        void apply() {
            for (Incident incident : stagedIncidents.values()) {
                String key = indexKey(incident.service(), incident.kind());
                incidents.put(incident.id(), incident);
                if (incident.isActive()) {
                    activeIndex.put(key, incident.id());
                } else if (Objects.equals(activeIndex.get(key), incident.id())) {
                    activeIndex.remove(key);
                }
            }
            for (RemediationAction action : stagedActions) {
                actions.put(action.id(), action);
            }
            breakers.putAll(stagedBreakers);
            Instant cutoff = clock.instant().minus(WINDOW_RETENTION);
            for (ActionWindowEntry entry : stagedEntries) {
                Deque<ActionWindowEntry> entries =
                        window.computeIfAbsent(windowKey(entry.service(), entry.actionType()), k -> new ArrayDeque<>());
                entries.addLast(entry);
                while (!entries.isEmpty() && entries.peekFirst().timestamp().isBefore(cutoff)) {
                    entries.removeFirst();
                }
            }
        }
    }
}
