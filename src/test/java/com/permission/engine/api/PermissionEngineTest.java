package com.permission.engine.api;

import com.permission.engine.audit.AuditAction;
import com.permission.engine.audit.AuditService;
import com.permission.engine.audit.InMemoryAuditRepository;
import com.permission.engine.cache.CacheTier;
import com.permission.engine.config.ConfigurationSource;
import com.permission.engine.core.error.CircularInheritanceException;
import com.permission.engine.core.error.ConfigurationInvalidException;
import com.permission.engine.core.error.ConfigurationLoadException;
import com.permission.engine.core.error.RoleAlreadyExistsException;
import com.permission.engine.core.error.RoleInUseException;
import com.permission.engine.core.error.RoleNotFoundException;
import com.permission.engine.core.model.PermissionConfiguration;
import com.permission.engine.core.model.Role;
import com.permission.engine.core.model.User;
import com.permission.engine.decision.GrantOverrideRule;
import com.permission.engine.decision.PermissionDecision;
import com.permission.engine.event.PermissionEvent;
import com.permission.engine.event.PermissionEventListener;
import com.permission.engine.event.PermissionEventType;
import com.permission.engine.health.HealthStatus;
import com.permission.engine.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

class PermissionEngineTest {

    private static final PermissionConfiguration NEWSROOM = PermissionConfiguration.builder()
            .role("viewer", List.of("read:articles"))
            .role("editor", List.of("write:articles"), List.of("viewer"))
            .role("sections", List.of("write:articles.*"))
            .user("banned", List.of(), List.of("read:*"))
            .user("guest-author", List.of("write:articles"), List.of())
            .build();

    private PermissionEngine engine;
    private final List<PermissionEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        engine = PermissionEngine.builder()
                .configuration(NEWSROOM)
                .listener(events::add)
                .build();
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Nested
    @DisplayName("Permission checks")
    class CheckTests {

        @Test
        @DisplayName("Editor inherits read access from viewer")
        void endToEndExample() {
            assertEquals(Set.of("write:articles", "read:articles"), engine.getPermissionsForRole("editor"));
            assertTrue(engine.hasPermission(User.of("1", "editor"), "read", "articles"));
            assertTrue(engine.hasPermission(User.of("1", "editor"), "write:articles"));
            assertFalse(engine.hasPermission(User.of("2", "viewer"), "write", "articles"));
        }

        @Test
        @DisplayName("A deny override beats the role grant")
        void denyBeatsRole() {
            assertFalse(engine.hasPermission(User.of("banned", "editor"), "read", "articles"));
            assertTrue(engine.hasPermission(User.of("banned", "editor"), "write", "articles"));
        }

        @Test
        @DisplayName("A grant override wins when the role lacks the permission")
        void grantOverride() {
            PermissionDecision decision = engine.explain(User.of("guest-author", "viewer"), "write", "articles");
            assertTrue(decision.isGranted());
            assertEquals(GrantOverrideRule.NAME, decision.rule());
        }

        @Test
        @DisplayName("Wildcards respect the literal boundary")
        void wildcardBoundary() {
            User user = User.of("3", "sections");
            assertTrue(engine.hasPermission(user, "write", "articles.section1"));
            assertTrue(engine.hasPermission(user, "write", "articles."));
            assertFalse(engine.hasPermission(user, "write", "articles"));
        }

        @Test
        @DisplayName("A missing role raises RoleNotFound instead of denying")
        void missingRoleRaises() {
            assertThrows(RoleNotFoundException.class,
                    () -> engine.hasPermission(User.of("1", "ghost"), "read", "articles"));
        }

        @Test
        @DisplayName("Null and empty contexts both check the bare permission")
        void nullAndEmptyContext() {
            engine.addRole("bare", List.of("read"));
            User user = User.of("4", "bare");
            assertTrue(engine.hasPermission(user, "read", null));
            assertTrue(engine.hasPermission(user, "read", ""));
            assertEquals("read", engine.explain(user, "read", "").permissionKey());
            assertFalse(engine.hasPermission(user, "write", ""));
        }

        @Test
        @DisplayName("Two users sharing an id but holding different roles get their own decisions")
        void roleIsPartOfDecisionKey() {
            assertTrue(engine.hasPermission(User.of("shared", "editor"), "write", "articles"));
            assertFalse(engine.hasPermission(User.of("shared", "viewer"), "write", "articles"));
        }
    }

    @Nested
    @DisplayName("checkAll / checkAny")
    class AggregateTests {

        @Test
        void checkAllRequiresEveryPermission() {
            User editor = User.of("1", "editor");
            assertTrue(engine.checkAll(editor, List.of("read", "write"), "articles"));
            assertFalse(engine.checkAll(User.of("2", "viewer"), List.of("read", "write"), "articles"));
            assertTrue(engine.checkAll(editor, List.of()));
        }

        @Test
        void checkAnyRequiresOnePermission() {
            User viewer = User.of("2", "viewer");
            assertTrue(engine.checkAny(viewer, List.of("write", "read"), "articles"));
            assertFalse(engine.checkAny(viewer, List.of("write", "delete"), "articles"));
            assertFalse(engine.checkAny(viewer, List.of()));
        }

        @Test
        @DisplayName("Resolution failures propagate from both aggregates")
        void failuresPropagate() {
            User ghost = User.of("1", "ghost");
            assertThrows(RoleNotFoundException.class, () -> engine.checkAll(ghost, List.of("read:articles")));
            assertThrows(RoleNotFoundException.class, () -> engine.checkAny(ghost, List.of("read:articles")));
        }
    }

    @Nested
    @DisplayName("Role management")
    class MutationTests {

        @Test
        @DisplayName("addRole makes the role usable immediately")
        void addRole() {
            engine.addRole("publisher", List.of("publish:articles"), List.of("editor"));

            assertTrue(engine.hasRole("publisher"));
            assertTrue(engine.hasPermission(User.of("5", "publisher"), "read", "articles"));
            assertEquals(PermissionEventType.ROLE_ADDED, events.get(0).type());
            assertEquals("publisher", events.get(0).roleName());
        }

        @Test
        @DisplayName("addRole rejects an existing name")
        void addExistingRole() {
            assertThrows(RoleAlreadyExistsException.class, () -> engine.addRole("viewer", List.of("x")));
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("Empty permission strings are stored and matched like any other")
        void addRoleAcceptsEmptyPermission() {
            engine.addRole("odd", List.of(""));
            engine.addPermissionToRole("odd", "");

            assertTrue(engine.hasRole("odd"));
            assertEquals(List.of("", ""), engine.getConfiguration().getRole("odd").orElseThrow().permissions());
            assertTrue(engine.hasPermission(User.of("5", "odd"), "", null));
            assertFalse(engine.hasPermission(User.of("5", "odd"), "read", null));
        }

        @Test
        @DisplayName("removeRole of an inherited role fails and changes nothing")
        void removeInheritedRole() {
            PermissionConfiguration before = engine.getConfiguration();

            RoleInUseException e = assertThrows(RoleInUseException.class, () -> engine.removeRole("viewer"));

            assertEquals(List.of("editor"), e.getDependentRoles());
            assertEquals(before, engine.getConfiguration());
            assertTrue(engine.hasPermission(User.of("1", "editor"), "read", "articles"));
            assertTrue(events.isEmpty());
        }

        @Test
        void removeRole() {
            engine.removeRole("sections");
            assertFalse(engine.hasRole("sections"));
            assertThrows(RoleNotFoundException.class, () -> engine.removeRole("sections"));
            assertEquals(PermissionEventType.ROLE_REMOVED, events.get(0).type());
        }

        @Test
        @DisplayName("A self-inheriting role can be removed")
        void removeSelfInheritingRole() {
            engine.addRole("loop", List.of("x"), List.of("loop"));
            engine.removeRole("loop");
            assertFalse(engine.hasRole("loop"));
        }

        @Test
        @DisplayName("addPermissionToRole is visible through inheritance right away")
        void addPermissionInvalidatesDependents() {
            User editor = User.of("1", "editor");
            assertFalse(engine.hasPermission(editor, "comment", "articles"));

            engine.addPermissionToRole("viewer", "comment:articles");

            assertTrue(engine.hasPermission(editor, "comment", "articles"));
            assertEquals(PermissionEventType.PERMISSION_ADDED, events.get(0).type());
            assertEquals("comment:articles", events.get(0).details().get("permission"));
        }

        @Test
        @DisplayName("addPermissionToRole keeps duplicates in the role's own list")
        void addPermissionKeepsDuplicates() {
            engine.addPermissionToRole("viewer", "read:articles");
            Role viewer = engine.getConfiguration().getRole("viewer").orElseThrow();
            assertEquals(List.of("read:articles", "read:articles"), viewer.permissions());
            assertEquals(Set.of("read:articles"), engine.getPermissionsForRole("viewer"));
        }

        @Test
        void addPermissionToMissingRole() {
            assertThrows(RoleNotFoundException.class, () -> engine.addPermissionToRole("ghost", "x"));
        }

        @Test
        @DisplayName("revokePermissionFromRole removes the grant and its inherited effect")
        void revokePermission() {
            User editor = User.of("1", "editor");
            assertTrue(engine.hasPermission(editor, "read", "articles"));

            engine.revokePermissionFromRole("viewer", "read:articles");

            assertFalse(engine.hasPermission(editor, "read", "articles"));
            assertTrue(engine.getPermissionsForRole("viewer").isEmpty());
            assertEquals(PermissionEventType.PERMISSION_REVOKED, events.get(0).type());
            assertThrows(RoleNotFoundException.class, () -> engine.revokePermissionFromRole("ghost", "x"));
        }

        @Test
        @DisplayName("Snapshots handed out earlier are not affected by later mutations")
        void snapshotsAreImmutable() {
            PermissionConfiguration before = engine.getConfiguration();
            engine.addRole("publisher", List.of("publish"));
            assertFalse(before.hasRole("publisher"));
            assertTrue(engine.getConfiguration().hasRole("publisher"));
        }
    }

    @Nested
    @DisplayName("Configuration replacement")
    class ReplacementTests {

        @Test
        @DisplayName("replaceConfiguration swaps roles and drops cached decisions")
        void replaceConfiguration() {
            User user = User.of("1", "editor");
            assertTrue(engine.hasPermission(user, "read", "articles"));

            engine.replaceConfiguration(PermissionConfiguration.builder()
                    .role("editor", List.of("write:articles"))
                    .build());

            assertFalse(engine.hasPermission(user, "read", "articles"));
            assertEquals(List.of("editor"), engine.listRoles());
            assertEquals(PermissionEventType.CONFIGURATION_RELOADED, events.get(0).type());
        }

        @Test
        @DisplayName("An invalid replacement leaves the configuration and caches in place")
        void invalidReplacement() {
            User user = User.of("1", "editor");
            assertTrue(engine.hasPermission(user, "read", "articles"));
            assertThrows(ConfigurationInvalidException.class, () -> engine.replaceConfiguration(null));

            assertEquals(NEWSROOM, engine.getConfiguration());
            assertTrue(engine.hasPermission(user, "read", "articles"));
            assertTrue(events.isEmpty());
        }

        @Test
        @DisplayName("A configuration with a cycle is accepted; the cycle fails at check time")
        void cyclesSurfaceAtResolution() {
            engine.replaceConfiguration(PermissionConfiguration.builder()
                    .role("A", List.of("a"), List.of("B"))
                    .role("B", List.of("b"), List.of("A"))
                    .build());

            assertThrows(CircularInheritanceException.class, () -> engine.hasPermission(User.of("1", "A"), "a"));
            assertThrows(CircularInheritanceException.class, () -> engine.hasPermission(User.of("1", "B"), "b"));
            assertTrue(engine.health().isDown());
        }

        @Test
        @DisplayName("listUsers returns override owners in insertion order")
        void listUsers() {
            assertEquals(List.of("banned", "guest-author"), engine.listUsers());
        }
    }

    @Nested
    @DisplayName("Reload from a source")
    @ExtendWith(MockitoExtension.class)
    class ReloadTests {

        @Mock
        ConfigurationSource source;

        @Test
        void reloadInstallsLoadedConfiguration() {
            PermissionConfiguration loaded = PermissionConfiguration.builder()
                    .role("auditor", List.of("read:logs"))
                    .build();
            when(source.load()).thenReturn(loaded);
            when(source.describe()).thenReturn("test-source");

            assertSame(loaded, engine.reload(source));

            assertEquals(List.of("auditor"), engine.listRoles());
            assertEquals("test-source", events.get(0).details().get("source"));
        }

        @Test
        @DisplayName("A failed load keeps the previous configuration")
        void failedLoadKeepsConfiguration() {
            when(source.load()).thenThrow(new ConfigurationLoadException("test-source", "unreachable"));
            when(source.describe()).thenReturn("test-source");

            assertThrows(ConfigurationLoadException.class, () -> engine.reload(source));

            assertEquals(NEWSROOM, engine.getConfiguration());
            assertTrue(events.isEmpty());
        }

        @Test
        void reloadAsyncInstallsOnCompletion() throws Exception {
            PermissionConfiguration loaded = PermissionConfiguration.builder()
                    .role("auditor", List.of("read:logs"))
                    .build();
            when(source.loadAsync()).thenReturn(CompletableFuture.completedFuture(loaded));
            when(source.describe()).thenReturn("async-source");

            engine.reloadAsync(source).get(5, TimeUnit.SECONDS);

            assertTrue(engine.hasPermission(User.of("1", "auditor"), "read", "logs"));
        }

        @Test
        @DisplayName("A failed asynchronous load completes exceptionally and keeps the configuration")
        void reloadAsyncFailure() {
            when(source.loadAsync()).thenReturn(CompletableFuture.failedFuture(
                    new ConfigurationLoadException("async-source", "HTTP 503")));
            when(source.describe()).thenReturn("async-source");

            CompletableFuture<PermissionConfiguration> future = engine.reloadAsync(source);

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertInstanceOf(ConfigurationLoadException.class, e.getCause());
            assertEquals(NEWSROOM, engine.getConfiguration());
        }
    }

    @Nested
    @DisplayName("Caching")
    class CachingTests {

        @Test
        @DisplayName("Repeated checks are served from the decision cache")
        void decisionsAreCached() {
            User user = User.of("1", "editor");
            engine.hasPermission(user, "read", "articles");
            engine.hasPermission(user, "read", "articles");

            assertEquals(1, engine.getCacheStats(CacheTier.DECISIONS).hitCount());
        }

        @Test
        @DisplayName("clearCache never changes an outcome")
        void clearCacheIsTransparent() {
            List<Boolean> before = allOutcomes(engine);
            engine.clearCache();
            assertEquals(0, engine.getCacheStats(CacheTier.DECISIONS).size());
            assertEquals(before, allOutcomes(engine));
            assertEquals(before, allOutcomes(engine));
        }

        @Test
        @DisplayName("Uncached engines decide the same way")
        void uncachedAgrees() {
            List<Boolean> cached = allOutcomes(engine);
            try (PermissionEngine uncached = PermissionEngine.builder()
                    .configuration(NEWSROOM)
                    .options(PermissionEngineOptions.uncached())
                    .build()) {
                assertEquals(cached, allOutcomes(uncached));
                assertEquals(0, uncached.getCacheStats(CacheTier.DECISIONS).hitCount());
            }
        }

        private List<Boolean> allOutcomes(PermissionEngine engine) {
            List<Boolean> outcomes = new ArrayList<>();
            for (String role : List.of("viewer", "editor", "sections")) {
                for (String userId : List.of("1", "banned", "guest-author")) {
                    User user = User.of(userId, role);
                    for (String permission : List.of("read", "write", "delete")) {
                        outcomes.add(engine.hasPermission(user, permission, "articles"));
                        outcomes.add(engine.hasPermission(user, permission, "articles.x"));
                        outcomes.add(engine.hasPermission(user, permission));
                    }
                }
            }
            return outcomes;
        }
    }

    @Nested
    @DisplayName("Listeners and audit")
    class ListenerTests {

        @Test
        @DisplayName("A failing listener does not affect the mutation or other listeners")
        void failingListenerIsIsolated() {
            List<PermissionEvent> seen = new ArrayList<>();
            engine.addListener(event -> {
                throw new IllegalStateException("boom");
            });
            engine.addListener(seen::add);

            engine.addRole("publisher", List.of("publish"));

            assertTrue(engine.hasRole("publisher"));
            assertEquals(1, seen.size());
        }

        @Test
        @DisplayName("Listeners see the committed configuration")
        void listenersSeeCommittedState() {
            List<Boolean> visible = new ArrayList<>();
            engine.addListener(event -> visible.add(engine.hasRole("publisher")));

            engine.addRole("publisher", List.of("publish"));

            assertEquals(List.of(true), visible);
        }

        @Test
        void removedListenerIsNotCalled() {
            List<PermissionEvent> seen = new ArrayList<>();
            PermissionEventListener listener = seen::add;
            engine.addListener(listener);
            engine.removeListener(listener);
            engine.addRole("publisher", List.of("publish"));
            assertTrue(seen.isEmpty());
        }

        @Test
        @DisplayName("The audit repository receives one entry per committed change")
        void auditTrail() {
            InMemoryAuditRepository repository = new InMemoryAuditRepository();
            try (PermissionEngine audited = PermissionEngine.builder()
                    .configuration(NEWSROOM)
                    .options(PermissionEngineOptions.builder().actorId("ops").build())
                    .auditRepository(repository)
                    .build()) {
                audited.addRole("publisher", List.of("publish"));
                audited.addPermissionToRole("publisher", "unpublish");
                assertThrows(RoleInUseException.class, () -> audited.removeRole("viewer"));
                audited.removeRole("publisher");

                assertEquals(3, repository.count());
                assertEquals(AuditAction.ROLE_ADDED, repository.findAll().get(0).action());
                assertEquals("ops", repository.findAll().get(0).actorId());
                assertEquals(3, repository.findBySubject("publisher").size());
            }
        }

        @Test
        void auditServiceCanBeShared() {
            AuditService auditService = new AuditService();
            try (PermissionEngine audited = PermissionEngine.builder()
                    .configuration(NEWSROOM)
                    .auditService(auditService)
                    .build()) {
                audited.replaceConfiguration(NEWSROOM);
                assertEquals(1, auditService.getEntriesByAction(AuditAction.CONFIGURATION_RELOADED).size());
            }
        }
    }

    @Nested
    @DisplayName("Observability")
    class ObservabilityTests {

        @Test
        @DisplayName("Decisions, failures and mutations are counted")
        void metricsAreRecorded() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            try (PermissionEngine measured = PermissionEngine.builder()
                    .configuration(NEWSROOM)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build()) {
                measured.hasPermission(User.of("1", "editor"), "read", "articles");
                measured.hasPermission(User.of("1", "viewer"), "write", "articles");
                assertThrows(RoleNotFoundException.class,
                        () -> measured.hasPermission(User.of("1", "ghost"), "read"));
                measured.addRole("publisher", List.of("publish"));

                assertEquals(1.0, registry.get("permission.decision").tag("outcome", "granted").counter().count());
                assertEquals(1.0, registry.get("permission.decision").tag("outcome", "denied").counter().count());
                assertEquals(1.0, registry.get("permission.resolution.failure")
                        .tag("code", "ROLE_NOT_FOUND").counter().count());
                assertEquals(1.0, registry.get("permission.role.mutation")
                        .tag("operation", "addRole").counter().count());
                assertEquals(3, registry.get("permission.decision.duration").timer().count());
            }
        }

        @Test
        void healthIsUpForSoundGraph() {
            HealthStatus health = engine.health();
            assertTrue(health.isUp());
        }

        @Test
        void healthIsDownForMissingParent() {
            engine.addRole("orphan", List.of("x"), List.of("missing"));
            HealthStatus health = engine.health();
            assertTrue(health.isDown());
            assertTrue(health.message().startsWith("roleGraph"));
        }
    }

    @Test
    @DisplayName("Concurrent checks and mutations never observe stale decisions")
    void concurrentChecksAndMutations() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 6; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int n = 0; n < 500; n++) {
                        assertTrue(engine.hasPermission(User.of("1", "editor"), "read", "articles"));
                        engine.hasPermission(User.of("1", "viewer"), "toggle");
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                for (int n = 0; n < 200; n++) {
                    engine.addPermissionToRole("viewer", "toggle");
                    assertTrue(engine.hasPermission(User.of("2", "viewer"), "toggle"));
                    engine.revokePermissionFromRole("viewer", "toggle");
                    assertFalse(engine.hasPermission(User.of("2", "viewer"), "toggle"));
                }
                return null;
            }));
            start.countDown();
            for (Future<?> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    throw new CompletionException(e.getCause());
                }
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
