package com.keystone.agent;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.container.DIContainer;
import com.keystone.container.config.ConfigurationLoader;
import com.keystone.tenancy.TenantManagementUtility;
import com.keystone.tenancy.model.AuditOutcome;
import com.keystone.tenancy.model.AuditRecord;
import com.keystone.tenancy.model.TenantSpec;
import com.keystone.tenancy.model.TenantStatus;
import com.keystone.tenancy.model.TenantPatch;
import com.keystone.utilities.UtilityNames;
import com.keystone.utilities.error.ErrorHandlerUtility;
import com.keystone.utilities.logging.CorrelationContextHolder;
import com.keystone.utilities.security.CallerContext;
import com.keystone.utilities.security.SecurityUtility;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.data.SpanData;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("AgentServiceBase")
class AgentServiceBaseTest {

    private static final CallerContext ALICE = CallerContext.user("alice");

    private final InMemorySpanExporter spans = InMemorySpanExporter.create();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private DIContainer container;
    private RecordingAgent agent;

    @BeforeEach
    void setUp() {
        container = DIContainer.builder("recorder")
                .configurationLoader(ConfigurationLoader.fixed(Map.of()))
                .utilities(PlatformUtilities.builder().telemetry(spans, meters).build())
                .build();
        container.initialize(Map.of(SecurityUtility.PLATFORM_ADMINS_KEY, "root"));
        agent = new RecordingAgent(container);
        agent.tenants().createTenant(ALICE, TenantSpec.of("acme", "Acme Corp")).orElseThrow();
    }

    @AfterEach
    void tearDown() {
        container.shutdown();
    }

    private AgentResponse send(String capability, String tenantId, String userId) {
        return agent.handle(AgentRequest.of(capability, tenantId, userId, Map.of("text", "hi")));
    }

    private List<AuditOutcome> auditOutcomes(String action) {
        return container.getUtility(UtilityNames.TENANT, TenantManagementUtility.class).auditTrail("acme").stream()
                .filter(r -> r.action().equals(action))
                .map(AuditRecord::outcome)
                .toList();
    }

    @Nested
    @DisplayName("Access")
    class Access {

        @Test
        @DisplayName("should run a capability for a tenant member")
        void shouldRunCapabilityForMember() {
            AgentResponse response = send("echo", "acme", "alice");

            assertThat(response.status()).isEqualTo(AgentResponse.Status.SUCCESS);
            assertThat(response.payload()).containsEntry("echo", Map.of("text", "hi"));
            assertThat(auditOutcomes("echo")).containsExactly(AuditOutcome.SUCCESS);
        }

        @Test
        @DisplayName("should deny a user who is not a member without running the capability")
        void shouldDenyNonMember() {
            AgentResponse response = send("echo", "acme", "mallory");

            assertThat(response.status()).isEqualTo(AgentResponse.Status.DENIED);
            assertThat(response.errorCode()).isEqualTo("ACCESS_DENIED");
            assertThat(agent.seenTenantMdc).isEmpty();
        }

        @Test
        @DisplayName("should deny unauthenticated requests")
        void shouldDenyUnauthenticated() {
            AgentResponse response = send("echo", "acme", null);

            assertThat(response.status()).isEqualTo(AgentResponse.Status.DENIED);
            assertThat(agent.seenTenantMdc).isEmpty();
        }

        @Test
        @DisplayName("should deny members of a suspended tenant")
        void shouldDenySuspendedTenant() {
            agent.tenants().updateTenant(ALICE, "acme", TenantPatch.status(TenantStatus.SUSPENDED)).orElseThrow();

            assertThat(send("echo", "acme", "alice").status()).isEqualTo(AgentResponse.Status.DENIED);
        }

        @Test
        @DisplayName("should report an unknown tenant as NOT_FOUND")
        void shouldReportUnknownTenant() {
            AgentResponse response = send("echo", "nowhere", "alice");

            assertThat(response.status()).isEqualTo(AgentResponse.Status.ERROR);
            assertThat(response.errorCode()).isEqualTo("NOT_FOUND");
        }

        @Test
        @DisplayName("should reject unknown capabilities and missing tenants before resolving access")
        void shouldRejectMalformedRequests() {
            assertThat(send("teleport", "acme", "alice").errorCode()).isEqualTo("UNKNOWN_CAPABILITY");
            assertThat(send("echo", " ", "alice").errorCode()).isEqualTo("INVALID_REQUEST");
            assertThat(agent.seenTenantMdc).isEmpty();
        }
    }

    @Nested
    @DisplayName("Feature gating")
    class FeatureGating {

        @Test
        @DisplayName("should run capabilities whose feature comes with the tenant tier")
        void shouldAllowTierFeature() {
            assertThat(send("insights", "acme", "alice").isSuccess()).isTrue();
        }

        @Test
        @DisplayName("should deny a gated capability until the feature is granted")
        void shouldGateUntilGranted() {
            assertThat(send("beta", "acme", "alice").status()).isEqualTo(AgentResponse.Status.DENIED);

            agent.tenants().grantTenantFeature(ALICE, "acme", "beta_feature").orElseThrow();

            assertThat(send("beta", "acme", "alice").isSuccess()).isTrue();
            assertThat(auditOutcomes("beta")).containsExactly(AuditOutcome.DENIED, AuditOutcome.SUCCESS);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("should classify exceptions through the error handler")
        void shouldClassifyExceptions() {
            AgentResponse badInput = send("bad_input", "acme", "alice");
            AgentResponse gone = send("lookup_gone", "acme", "alice");

            assertThat(badInput.errorCode()).isEqualTo("INVALID_ARGUMENT");
            assertThat(badInput.message()).isEqualTo("text must not be blank");
            assertThat(gone.errorCode()).isEqualTo("TENANT_NOT_FOUND");
            assertThat(container.getUtility(UtilityNames.ERROR_HANDLER, ErrorHandlerUtility.class).errorCounts())
                    .containsEntry("INVALID_ARGUMENT", 1L)
                    .containsEntry("TENANT_NOT_FOUND", 1L);
            assertThat(auditOutcomes("bad_input")).containsExactly(AuditOutcome.FAILURE);
        }

        @Test
        @DisplayName("should turn a missing response into INTERNAL_ERROR")
        void shouldHandleMissingResponse() {
            AgentResponse response = send("silent", "acme", "alice");

            assertThat(response.status()).isEqualTo(AgentResponse.Status.ERROR);
            assertThat(response.errorCode()).isEqualTo(ErrorHandlerUtility.INTERNAL_ERROR);
        }
    }

    @Nested
    @DisplayName("Observability")
    class Observability {

        @Test
        @DisplayName("should expose the tenant in MDC only while the capability runs")
        void shouldScopeCorrelationContext() {
            send("echo", "acme", "alice");

            assertThat(agent.seenTenantMdc).containsExactly("acme");
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should export a server span per capability call")
        void shouldExportSpan() {
            send("echo", "acme", "alice");

            List<SpanData> exported = spans.getFinishedSpanItems();
            assertThat(exported).extracting(SpanData::getName).contains("agent.echo");
            SpanData span = exported.stream().filter(s -> s.getName().equals("agent.echo")).findFirst().orElseThrow();
            assertThat(span.getAttributes().get(AttributeKey.stringKey(AgentServiceBase.ATTR_AGENT)))
                    .isEqualTo("recorder");
        }

        @Test
        @DisplayName("should count requests by capability and status")
        void shouldCountRequests() {
            send("echo", "acme", "alice");
            send("echo", "acme", "mallory");

            assertThat(meters.get(AgentServiceBase.REQUESTS_METRIC)
                    .tags("capability", "echo", "status", "SUCCESS").counter().count()).isEqualTo(1.0);
            assertThat(meters.get(AgentServiceBase.REQUESTS_METRIC)
                    .tags("capability", "echo", "status", "DENIED").counter().count()).isEqualTo(1.0);
        }
    }
}
