package dev.guardrails;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import dev.guardrails.support.TestKeys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockMvcRequestBuilders;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full application against a stubbed GitHub API and analysis backend: one signed
 * pull request delivery travels through every stage to a published status.
 */
@SpringBootTest
@AutoConfigureMockMvc
class GuardrailsApplicationTest {

    private static final String SECRET = "integration-secret";

    @RegisterExtension
    static WireMockExtension remote = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("guardrails.github.app-id", () -> "42");
        registry.add("guardrails.github.private-key", TestKeys::pkcs8Pem);
        registry.add("guardrails.github.webhook-secret", () -> SECRET);
        registry.add("guardrails.github.api-base-url", remote::baseUrl);
        registry.add("guardrails.scanner.base-url", remote::baseUrl);
        registry.add("guardrails.scanner.initial-backoff", () -> "10ms");
        registry.add("guardrails.pipeline.ack-timeout", () -> "20s");
    }

    @Autowired
    private MockMvc mockMvc;

    private static String sign(String body) throws Exception {
        Mac mac = Mac.getInstance("HmacSHA256");
        mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
        return "sha256=" + HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("a signed pull request delivery is scanned and published")
    void pullRequestEndToEnd() throws Exception {
        remote.stubFor(post(urlPathEqualTo("/app/installations/77/access_tokens"))
                .willReturn(okJson("{\"token\":\"ghs_it\",\"expires_at\":\"2099-01-01T00:00:00Z\"}")));
        remote.stubFor(get(urlPathEqualTo("/repos/acme/widgets/pulls/7/files"))
                .willReturn(okJson("[{\"filename\":\"src/App.java\",\"status\":\"modified\",\"patch\":\"@@\","
                        + "\"additions\":1,\"deletions\":0,\"changes\":1}]")));
        remote.stubFor(get(urlPathEqualTo("/repos/acme/widgets/contents/src/App.java"))
                .willReturn(ok("class App { String key = \"AKIA\"; }")));
        remote.stubFor(get(urlPathEqualTo("/health"))
                .willReturn(okJson("{\"status\":\"healthy\"}")));
        remote.stubFor(post(urlPathEqualTo("/scan")).willReturn(okJson("""
                {"scan_id":"scan-it","repository":"acme/widgets",
                 "violations":[{"rule_id":"SEC-001","rule_name":"Hardcoded secret","category":"security",
                   "severity":"high","file_path":"src/App.java","line_number":1,"message":"Secret in source",
                   "explanation":"Use the environment.","standard_mappings":[],"is_copilot_generated":false}],
                 "enforcement_action":"blocking","can_merge":false,"copilot_detected":false,
                 "processing_time_ms":12.0}
                """)));
        remote.stubFor(post(urlPathEqualTo("/repos/acme/widgets/issues/7/comments")).willReturn(created()));
        remote.stubFor(post(urlPathEqualTo("/repos/acme/widgets/pulls/7/comments")).willReturn(created()));
        remote.stubFor(post(urlPathEqualTo("/repos/acme/widgets/statuses/abc123")).willReturn(created()));

        String body = """
                {"action":"opened",
                 "pull_request":{"number":7,"head":{"sha":"abc123","ref":"topic"},"base":{"ref":"main"}},
                 "repository":{"full_name":"acme/widgets","name":"widgets","owner":{"login":"acme"}},
                 "installation":{"id":77},
                 "sender":{"login":"dev"}}
                """;

        mockMvc.perform(MockMvcRequestBuilders.post("/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "pull_request")
                        .header("X-GitHub-Delivery", "it-delivery-1")
                        .header("X-Hub-Signature-256", sign(body))
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processed"))
                .andExpect(jsonPath("$.violations").value(1))
                .andExpect(jsonPath("$.mergeable").value(false));

        remote.verify(1, postRequestedFor(urlPathEqualTo("/repos/acme/widgets/issues/7/comments")));
        remote.verify(1, postRequestedFor(urlPathEqualTo("/repos/acme/widgets/pulls/7/comments"))
                .withHeader("Authorization", equalTo("Bearer ghs_it")));
        remote.verify(1, postRequestedFor(urlPathEqualTo("/repos/acme/widgets/statuses/abc123"))
                .withRequestBody(matchingJsonPath("$.state", equalTo("failure"))));
    }

    @Test
    @DisplayName("a delivery signed with the wrong secret is rejected before any outbound call")
    void wrongSignatureRejected() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.post("/webhooks/github")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-GitHub-Event", "pull_request")
                        .header("X-GitHub-Delivery", "it-delivery-2")
                        .header("X-Hub-Signature-256", "sha256=" + "0".repeat(64))
                        .content("{\"action\":\"opened\"}"))
                .andExpect(status().isUnauthorized());

        remote.verify(0, anyRequestedFor(anyUrl()));
    }

    @Test
    @DisplayName("health is public")
    void healthIsPublic() throws Exception {
        mockMvc.perform(MockMvcRequestBuilders.get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
