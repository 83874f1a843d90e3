package com.ryuqq.milestone.cli.config;

import com.ryuqq.milestone.application.workflow.WorkflowKind;
import com.ryuqq.milestone.application.workflow.WorkflowSettings;
import com.ryuqq.milestone.core.model.Credential;
import com.ryuqq.milestone.core.model.CredentialRole;
import com.ryuqq.milestone.core.model.RepositoryId;
import com.ryuqq.milestone.core.protection.RateLimiterConfig;
import com.ryuqq.milestone.core.protection.RetryPolicyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code milestones.yaml}을 {@link MilestoneConfig}로 읽어 들입니다.
 *
 * <p><strong>구조:</strong></p>
 * <pre>
 * repository: owner/name
 * credentials:
 *   primary:   { login, token, email, api_base_url }
 *   secondary: { login, token, email, api_base_url }   # optional
 * settings:
 *   progress_file, dry_run, concurrency, max_duration, rate_limit_buffer, burst_limit
 * retry:
 *   max_attempts, base_delay, max_delay, jitter, throttle_wait
 * workflows:
 *   &lt;workflow name&gt;: { enabled, thresholds, batch_size, pacing, batch_pause, deadline,
 *                      alternate_authors, auto_accept_invitation, reviewer }
 * </pre>
 *
 * <p>문자열은 {@code ${NAME}} 형식으로 환경 변수를 참조할 수 있습니다. 설정되지 않은 변수는
 * 자리표시자를 그대로 두고 경고를 남기며, 실제 실행은 이후 자리표시자 토큰을 거부합니다.</p>
 *
 * <p>기간 값은 {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}, {@code 1d}, ISO-8601
 * ({@code PT5M}) 또는 초 단위 숫자를 받습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class YamlConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlConfigLoader.class);

    private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([^}]+)}");
    private static final Pattern SIMPLE_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)?");

    private final Yaml yaml;
    private final Function<String, String> environment;

    public YamlConfigLoader() {
        this(System::getenv);
    }

    /**
     * {@code environment}로 {@code ${NAME}}을 치환하는 로더를 만듭니다.
     *
     * @param environment 변수 조회 함수 (없는 이름은 null)
     */
    public YamlConfigLoader(Function<String, String> environment) {
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        this.environment = environment;
    }

    /**
     * 설정 파일을 읽어 해석합니다.
     *
     * @param file 설정 파일 경로
     * @return 해석된 설정
     * @throws ConfigurationException 파일이 없거나 읽을 수 없거나 잘못되었을 때
     */
    public MilestoneConfig load(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Configuration file not found: " + file);
        }
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file: " + file, e);
        }
        MilestoneConfig config = parse(content);
        log.info("Loaded configuration from {} ({} workflow overrides)", file, config.workflows().size());
        return config;
    }

    /**
     * 설정 텍스트를 해석합니다.
     *
     * @param content YAML 텍스트
     * @return 해석된 설정
     * @throws ConfigurationException 내용이 잘못되었을 때
     */
    public MilestoneConfig parse(String content) {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML: " + e.getMessage(), e);
        }
        if (loaded == null) {
            throw new ConfigurationException("Configuration is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = section(substitute(loaded), "configuration");

        try {
            return toConfig(root);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private MilestoneConfig toConfig(Map<String, Object> root) {
        RepositoryId repository = RepositoryId.parse(requiredString(root, "repository", "repository"));

        Map<String, Object> credentials = section(root.get("credentials"), "credentials");
        Object primarySection = credentials.get("primary");
        if (primarySection == null) {
            throw new ConfigurationException("credentials.primary is required");
        }
        Credential primary = credential(CredentialRole.PRIMARY, section(primarySection, "credentials.primary"),
            "credentials.primary");
        Object secondarySection = credentials.get("secondary");
        Credential secondary = secondarySection == null ? null
            : credential(CredentialRole.SECONDARY, section(secondarySection, "credentials.secondary"),
                "credentials.secondary");

        Map<String, Object> settings = section(root.get("settings"), "settings");
        RateLimiterConfig rateLimiter = new RateLimiterConfig();
        Long buffer = optionalLong(settings, "rate_limit_buffer", "settings");
        if (buffer != null) {
            rateLimiter = rateLimiter.withBuffer(buffer);
        }
        Long burst = optionalLong(settings, "burst_limit", "settings");
        if (burst != null) {
            rateLimiter = rateLimiter.withBurstLimit(burst.intValue());
        }

        Long concurrency = optionalLong(settings, "concurrency", "settings");
        Boolean dryRun = optionalBoolean(settings, "dry_run", "settings");
        String progressFile = optionalString(settings, "progress_file", "settings");

        return new MilestoneConfig(
            repository,
            primary,
            secondary,
            workflows(section(root.get("workflows"), "workflows")),
            rateLimiter,
            retry(section(root.get("retry"), "retry")),
            concurrency == null ? 0 : concurrency.intValue(),
            optionalDuration(settings, "max_duration", "settings"),
            dryRun != null && dryRun,
            progressFile == null ? null : Path.of(progressFile)
        );
    }

    private Credential credential(CredentialRole role, Map<String, Object> section, String path) {
        return new Credential(
            role,
            requiredString(section, "login", path),
            requiredString(section, "token", path),
            optionalString(section, "api_base_url", path),
            optionalString(section, "email", path)
        );
    }

    private RetryPolicyConfig retry(Map<String, Object> section) {
        RetryPolicyConfig defaults = new RetryPolicyConfig();
        Long maxAttempts = optionalLong(section, "max_attempts", "retry");
        Duration baseDelay = optionalDuration(section, "base_delay", "retry");
        Duration maxDelay = optionalDuration(section, "max_delay", "retry");
        Double jitter = optionalDouble(section, "jitter", "retry");
        Duration throttleWait = optionalDuration(section, "throttle_wait", "retry");
        return new RetryPolicyConfig(
            maxAttempts == null ? defaults.maxAttempts() : maxAttempts.intValue(),
            baseDelay == null ? defaults.baseDelayMs() : baseDelay.toMillis(),
            maxDelay == null ? defaults.maxDelayMs() : maxDelay.toMillis(),
            jitter == null ? defaults.jitterFactor() : jitter,
            throttleWait == null ? defaults.throttleWait() : throttleWait
        );
    }

    private Map<WorkflowKind, WorkflowSettings> workflows(Map<String, Object> section) {
        Map<WorkflowKind, WorkflowSettings> result = new EnumMap<>(WorkflowKind.class);
        for (Map.Entry<String, Object> entry : section.entrySet()) {
            WorkflowKind kind;
            try {
                kind = WorkflowKind.fromName(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("workflows." + entry.getKey() + ": " + e.getMessage(), e);
            }
            String path = "workflows." + entry.getKey();
            result.put(kind, workflowSettings(kind.defaults(), section(entry.getValue(), path), path));
        }
        return result;
    }

    private WorkflowSettings workflowSettings(WorkflowSettings defaults, Map<String, Object> section, String path) {
        WorkflowSettings settings = defaults;
        Boolean enabled = optionalBoolean(section, "enabled", path);
        if (enabled != null) {
            settings = settings.withEnabled(enabled);
        }
        List<Long> thresholds = optionalLongList(section, "thresholds", path);
        if (thresholds != null) {
            settings = settings.withThresholds(thresholds);
        }
        Long batchSize = optionalLong(section, "batch_size", path);
        if (batchSize != null) {
            settings = settings.withBatchSize(batchSize.intValue());
        }
        Duration pacing = optionalDuration(section, "pacing", path);
        Duration batchPause = optionalDuration(section, "batch_pause", path);
        if (pacing != null || batchPause != null) {
            settings = settings.withPacing(
                pacing == null ? settings.pacing() : pacing,
                batchPause == null ? settings.batchPause() : batchPause);
        }
        Duration deadline = optionalDuration(section, "deadline", path);
        if (deadline != null) {
            settings = settings.withDeadline(deadline);
        }
        Boolean alternateAuthors = optionalBoolean(section, "alternate_authors", path);
        if (alternateAuthors != null) {
            settings = settings.withAlternateAuthors(alternateAuthors);
        }
        Boolean autoAccept = optionalBoolean(section, "auto_accept_invitation", path);
        if (autoAccept != null) {
            settings = settings.withAutoAcceptInvitation(autoAccept);
        }
        String reviewer = optionalString(section, "reviewer", path);
        if (reviewer != null) {
            settings = settings.withReviewer(reviewer);
        }
        return settings;
    }

    // ============================================================
    // 환경 변수 치환
    // ============================================================

    private Object substitute(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((key, nested) -> result.put(String.valueOf(key), substitute(nested)));
            return result;
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object nested : list) {
                result.add(substitute(nested));
            }
            return result;
        }
        if (value instanceof String text) {
            return resolve(text);
        }
        return value;
    }

    private String resolve(String text) {
        Matcher matcher = ENV_REFERENCE.matcher(text);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1).trim();
            String resolved = environment.apply(name);
            if (resolved == null) {
                log.warn("Environment variable {} is not set, keeping placeholder", name);
                resolved = matcher.group(0);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    // ============================================================
    // 타입별 조회
    // ============================================================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Object value, String path) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new ConfigurationException(path + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static String requiredString(Map<String, Object> section, String key, String path) {
        String value = optionalString(section, key, path);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(path + "." + key + " is required");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> section, String key, String path) {
        Object value = section.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new ConfigurationException(path + "." + key + " must be a scalar");
        }
        return String.valueOf(value);
    }

    private static Long optionalLong(Map<String, Object> section, String key, String path) {
        Object value = section.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(path + "." + key + " must be an integer (current: " + value + ")", e);
        }
    }

    private static Double optionalDouble(Map<String, Object> section, String key, String path) {
        Object value = section.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(path + "." + key + " must be a number (current: " + value + ")", e);
        }
    }

    private static Boolean optionalBoolean(Map<String, Object> section, String key, String path) {
        Object value = section.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new ConfigurationException(path + "." + key + " must be true or false (current: " + value + ")");
    }

    private static List<Long> optionalLongList(Map<String, Object> section, String key, String path) {
        Object value = section.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException(path + "." + key + " must be a list");
        }
        List<Long> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Number number)) {
                throw new ConfigurationException(path + "." + key + " must contain integers (current: " + item + ")");
            }
            result.add(number.longValue());
        }
        return result;
    }

    private static Duration optionalDuration(Map<String, Object> section, String key, String path) {
        Object value = section.get(key);
        if (value == null) {
            return null;
        }
        try {
            return parseDuration(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(path + "." + key + ": " + e.getMessage(), e);
        }
    }

    /**
     * 기간 값을 해석합니다.
     *
     * @param value 초 단위 숫자, {@code <n>[ms|s|m|h|d]} 또는 ISO-8601 텍스트
     * @return 기간
     * @throws IllegalArgumentException 기간으로 해석할 수 없을 때
     */
    public static Duration parseDuration(Object value) {
        if (value instanceof Number number) {
            return Duration.ofSeconds(number.longValue());
        }
        String text = String.valueOf(value).trim();
        if (text.startsWith("P") || text.startsWith("p")) {
            try {
                return Duration.parse(text);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("invalid duration: " + text, e);
            }
        }
        Matcher matcher = SIMPLE_DURATION.matcher(text.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("invalid duration: " + text);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) == null ? "s" : matcher.group(2);
        switch (unit) {
            case "ms":
                return Duration.ofMillis(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            case "d":
                return Duration.ofDays(amount);
            default:
                return Duration.ofSeconds(amount);
        }
    }
}
