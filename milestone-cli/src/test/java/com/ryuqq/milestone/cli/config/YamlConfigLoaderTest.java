package com.ryuqq.milestone.cli.config;

import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.application.workflow.WorkflowSettings;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RepositoryId;
import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import com.ryuqq.milestone.core.protection.RetryPolicyConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link YamlConfigLoader}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class YamlConfigLoaderTest {

    private static final Map<String, String> ENV = Map.of(
        "MILESTONES_PRIMARY_TOKEN", "ghp_primary",
        "MILESTONES_SECONDARY_TOKEN", "ghp_secondary");

    private static final String MINIMAL = "repository: octocat/milestones\n"
        + "credentials:\n"
        + "  primary:\n"
        + "    login: octocat\n"
        + "    token: plain-token\n";

    private final YamlConfigLoader loader = new YamlConfigLoader(ENV::get);

    private static String example() throws IOException {
        try (InputStream in = YamlConfigLoaderTest.class.getResourceAsStream("/milestones.example.yaml")) {
            assertThat(in).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ============================================================
    // Parsing
    // ============================================================

    @Test
    void parse_ExampleConfiguration_MapsEverySection() throws IOException {
        // When
        MilestoneConfig config = loader.parse(example());

        // Then
        assertThat(config.repository()).isEqualTo(RepositoryId.parse("octocat/milestones"));
        assertThat(config.primary().login()).isEqualTo("octocat");
        assertThat(config.primary().token()).isEqualTo("ghp_primary");
        assertThat(config.primary().email()).isEqualTo("octocat@users.noreply.github.com");
        assertThat(config.secondary().login()).isEqualTo("hubot");
        assertThat(config.secondary().token()).isEqualTo("ghp_secondary");
        assertThat(config.unresolvedCredentials()).isEmpty();

        assertThat(config.progressFile()).isEqualTo(Path.of("progress.json"));
        assertThat(config.dryRun()).isFalse();
        assertThat(config.maxDuration()).isEqualTo(Duration.ofHours(6));
        assertThat(config.rateLimiter().buffer()).isEqualTo(100);
        assertThat(config.rateLimiter().burstLimit()).isEqualTo(30);
        assertThat(config.retry()).isEqualTo(new RetryPolicyConfig(5, 1000, 300000, 0.2, Duration.ofSeconds(60)));

        WorkflowSettings batch = config.workflows().get(WorkflowKind.BATCH_COUNTER);
        assertThat(batch.thresholds()).containsExactly(2L, 16L, 128L, 1024L);
        assertThat(batch.batchSize()).isEqualTo(10);
        assertThat(batch.pacing()).isEqualTo(Duration.ofSeconds(2));
        assertThat(batch.batchPause()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.workflows().get(WorkflowKind.TIME_BOXED).deadline()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.workflows().get(WorkflowKind.QUESTION_ANSWER).pacing()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.workflows().get(WorkflowKind.REVIEW_BYPASS).reviewer()).isNull();
    }

    @Test
    void parse_MinimalConfiguration_UsesDefaults() {
        // When
        MilestoneConfig config = loader.parse(MINIMAL);

        // Then
        assertThat(config.secondary()).isNull();
        assertThat(config.workflows()).isEmpty();
        assertThat(config.rateLimiter()).isEqualTo(new RateLimiterConfig());
        assertThat(config.retry()).isEqualTo(new RetryPolicyConfig());
        assertThat(config.progressFile()).isEqualTo(MilestoneConfig.DEFAULT_PROGRESS_FILE);
        assertThat(config.concurrency()).isZero();
        assertThat(config.maxDuration()).isNull();
    }

    @Test
    void parse_WorkflowOverride_KeepsUnsetFieldsFromDefaults() {
        // Given
        String yaml = MINIMAL
            + "workflows:\n"
            + "  pull_shark:\n"
            + "    enabled: false\n"
            + "    pacing: 500ms\n";

        // When
        WorkflowSettings settings = loader.parse(yaml).workflows().get(WorkflowKind.BATCH_COUNTER);

        // Then
        assertThat(settings.enabled()).isFalse();
        assertThat(settings.pacing()).isEqualTo(Duration.ofMillis(500));
        assertThat(settings.thresholds()).isEqualTo(WorkflowKind.BATCH_COUNTER.defaults().thresholds());
        assertThat(settings.batchPause()).isEqualTo(WorkflowKind.BATCH_COUNTER.defaults().batchPause());
    }

    // ============================================================
    // Environment substitution
    // ============================================================

    @Test
    void parse_EnvironmentReferenceInsideText_Substituted() {
        // Given
        String yaml = "repository: ${OWNER}/milestones\n"
            + "credentials:\n"
            + "  primary:\n"
            + "    login: ${OWNER}\n"
            + "    token: token-${SUFFIX}\n";
        YamlConfigLoader withEnv = new YamlConfigLoader(Map.of("OWNER", "octocat", "SUFFIX", "42")::get);

        // When
        MilestoneConfig config = withEnv.parse(yaml);

        // Then
        assertThat(config.repository().toString()).isEqualTo("octocat/milestones");
        assertThat(config.primary().token()).isEqualTo("token-42");
    }

    @Test
    void parse_UnsetVariable_KeepsPlaceholderAndReportsUnresolved() throws IOException {
        // Given
        YamlConfigLoader noEnv = new YamlConfigLoader(name -> null);

        // When
        MilestoneConfig config = noEnv.parse(example());

        // Then
        assertThat(config.primary().token()).isEqualTo("${MILESTONES_PRIMARY_TOKEN}");
        assertThat(config.unresolvedCredentials()).containsExactly(CredentialRole.PRIMARY, CredentialRole.SECONDARY);
    }

    // ============================================================
    // Errors
    // ============================================================

    @Test
    void load_MissingFile_Rejected(@TempDir Path directory) {
        assertThatThrownBy(() -> loader.load(directory.resolve("absent.yaml")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Configuration file not found");
    }

    @Test
    void parse_EmptyContent_Rejected() {
        assertThatThrownBy(() -> loader.parse(""))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("empty");
    }

    @Test
    void parse_MalformedYaml_Rejected() {
        assertThatThrownBy(() -> loader.parse("repository: [unclosed"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Invalid YAML");
    }

    @Test
    void parse_JavaTypeTag_RejectedBySafeConstructor() {
        assertThatThrownBy(() -> loader.parse("repository: !!java.io.File [\"/tmp\"]\n"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Invalid YAML");
    }

    @Test
    void parse_MissingPrimaryCredential_Rejected() {
        assertThatThrownBy(() -> loader.parse("repository: octocat/milestones\ncredentials: {}\n"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("credentials.primary is required");
    }

    @Test
    void parse_MissingToken_Rejected() {
        String yaml = "repository: octocat/milestones\n"
            + "credentials:\n"
            + "  primary:\n"
            + "    login: octocat\n";

        assertThatThrownBy(() -> loader.parse(yaml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("credentials.primary.token is required");
    }

    @Test
    void parse_UnknownWorkflow_Rejected() {
        assertThatThrownBy(() -> loader.parse(MINIMAL + "workflows:\n  arctic-vault: {}\n"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Unknown workflow: arctic-vault");
    }

    @Test
    void parse_InvalidThresholds_Rejected() {
        assertThatThrownBy(() -> loader.parse(MINIMAL + "workflows:\n  quickdraw:\n    thresholds: [0]\n"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("thresholds must be positive");
    }

    @Test
    void parse_InvalidDuration_Rejected() {
        assertThatThrownBy(() -> loader.parse(MINIMAL + "settings:\n  max_duration: soon\n"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("settings.max_duration")
            .hasMessageContaining("invalid duration: soon");
    }

    @Test
    void parse_BufferNotBelowLimit_Rejected() {
        assertThatThrownBy(() -> loader.parse(MINIMAL + "settings:\n  rate_limit_buffer: 5000\n"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("defaultLimit must be greater than buffer");
    }

    @Test
    void parse_InvalidRepository_Rejected() {
        String yaml = MINIMAL.replace("octocat/milestones", "not-a-repository");

        assertThatThrownBy(() -> loader.parse(yaml))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageStartingWith("Invalid configuration");
    }

    // ============================================================
    // Durations
    // ============================================================

    @ParameterizedTest
    @CsvSource({
        "500ms, PT0.5S",
        "30s, PT30S",
        "30, PT30S",
        "5m, PT5M",
        "2h, PT2H",
        "1d, PT24H",
        "PT90M, PT1H30M"
    })
    void parseDuration_SupportedForms(String text, String expected) {
        assertThat(YamlConfigLoader.parseDuration(text)).isEqualTo(Duration.parse(expected));
    }

    @Test
    void parseDuration_NumberIsSeconds() {
        assertThat(YamlConfigLoader.parseDuration(45)).isEqualTo(Duration.ofSeconds(45));
    }

    @Test
    void parseDuration_Invalid_Rejected() {
        assertThatThrownBy(() -> YamlConfigLoader.parseDuration("-5s"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> YamlConfigLoader.parseDuration(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
