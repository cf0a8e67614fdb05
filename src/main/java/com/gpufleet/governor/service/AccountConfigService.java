package com.gpufleet.governor.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.gpufleet.governor.model.AccountConfig;
import com.gpufleet.governor.model.BudgetPolicy;
import com.gpufleet.governor.model.FleetAccount;
import com.gpufleet.governor.model.FleetConfig;
import com.gpufleet.governor.model.KeyBudgetConfig;
import com.gpufleet.governor.model.LedgerScope;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Loads provider accounts and budget limits from {@code accounts.yaml}, and writes administrative
 * edits back to it.
 * <p>
 * With no accounts configured and a fallback API key present, a single {@code default} account is
 * synthesised so single-account deployments run the same code path.
 * <p>
 * The loaded configuration is never mutated in place. An edit builds a copy, persists it and then
 * swaps it in, so readers on other threads always iterate a consistent snapshot.
 */
@Service
public class AccountConfigService {

    private static final Logger log = LoggerFactory.getLogger(AccountConfigService.class);

    public static final String FALLBACK_ACCOUNT = "default";
    private static final String PLACEHOLDER_KEY = "your_api_key_here";
    private static final String CLEAR = "none";

    @Value("${fleet.accounts.path:data/accounts.yaml}")
    private String accountsPath;

    @Value("${lambda.api.key:}")
    private String fallbackApiKey;

    private final ObjectMapper yamlMapper;
    private volatile Snapshot snapshot = new Snapshot(new FleetConfig(), List.of());

    public AccountConfigService() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER));
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    }

    public void setAccountsPath(String path) {
        this.accountsPath = path;
    }

    public void setFallbackApiKey(String fallbackApiKey) {
        this.fallbackApiKey = fallbackApiKey;
    }

    @PostConstruct
    public void loadConfig() {
        Path path = Paths.get(accountsPath);
        FleetConfig loaded = new FleetConfig();
        if (Files.exists(path)) {
            try {
                FleetConfig parsed = yamlMapper.readValue(path.toFile(), FleetConfig.class);
                if (parsed != null) {
                    loaded = parsed;
                }
            } catch (IOException e) {
                log.error("Failed to load accounts from {}: {}", path, e.getMessage());
            }
        } else {
            log.info("Accounts file not found: {}", path);
        }
        normalize(loaded);

        if (loaded.getAccounts().isEmpty() && hasText(fallbackApiKey) && !PLACEHOLDER_KEY.equals(fallbackApiKey)) {
            AccountConfig fallback = new AccountConfig();
            fallback.setApiKey(fallbackApiKey);
            loaded.getAccounts().put(FALLBACK_ACCOUNT, fallback);
            log.info("No accounts configured, using fallback API key as account '{}'", FALLBACK_ACCOUNT);
        }
        install(loaded);
        log.info("Loaded {} account(s) and {} key budget(s)", loaded.getAccounts().size(), loaded.getKeys().size());
    }

    /** The current configuration. Treat it as read-only; edits go through {@link #updateBudget}. */
    public FleetConfig getConfig() {
        return snapshot.config;
    }

    /**
     * Accounts usable for reconciliation, resolved once per configuration change. Accounts without
     * a credential are left out.
     */
    public List<FleetAccount> getAccounts() {
        return snapshot.accounts;
    }

    public Optional<FleetAccount> findAccount(String name) {
        if (name == null) return Optional.empty();
        return snapshot.accounts.stream().filter(a -> a.getName().equals(name)).findFirst();
    }

    public List<String> getBudgetedKeys() {
        return new ArrayList<>(snapshot.config.getKeys().keySet());
    }

    /**
     * Effective budget for an account or key.
     *
     * @throws IllegalArgumentException when the identity is not configured or its limit is malformed
     */
    public BudgetPolicy resolveBudget(LedgerScope scope, String identity) {
        FleetConfig config = snapshot.config;
        String limitSetting;
        String webhook;
        if (scope == LedgerScope.ACCOUNT) {
            AccountConfig account = config.getAccounts().get(identity);
            if (account == null) throw new IllegalArgumentException("Unknown account: " + identity);
            limitSetting = account.getLimitCents();
            webhook = account.getAlertWebhook();
        } else {
            KeyBudgetConfig key = config.getKeys().get(identity);
            if (key == null) throw new IllegalArgumentException("No budget configured for key: " + identity);
            limitSetting = key.getLimitCents();
            webhook = key.getAlertWebhook();
        }

        boolean useDefault = isDefault(limitSetting);
        long limit = useDefault ? config.getDefaults().getLimitCents() : parseLimit(limitSetting, scope, identity);
        long interval = config.getDefaults().getMilestoneInterval();
        if (interval <= 0) {
            throw new IllegalArgumentException("milestone_interval must be positive, got " + interval);
        }
        return BudgetPolicy.builder()
            .scope(scope)
            .identity(identity)
            .limitCents(limit)
            .defaultLimit(useDefault)
            .milestoneInterval(interval)
            .alertWebhook(webhook)
            .build();
    }

    /**
     * Administrative edit of a budget. {@code limit} is "default" or an integer number of cents;
     * {@code webhook} "none" clears it. Null leaves a field unchanged. Key budgets are created on
     * first edit; accounts must already exist.
     */
    public synchronized BudgetPolicy updateBudget(LedgerScope scope, String identity, String limit, String webhook) {
        if (limit != null && !isDefault(limit)) {
            parseLimit(limit, scope, identity);
        }
        String normalizedLimit = limit == null ? null : (isDefault(limit) ? BudgetPolicy.DEFAULT_LIMIT : limit.trim());
        String normalizedWebhook = webhook == null ? null : (CLEAR.equalsIgnoreCase(webhook.trim()) ? "" : webhook.trim());

        FleetConfig next = copyOf(snapshot.config);
        if (scope == LedgerScope.ACCOUNT) {
            AccountConfig account = next.getAccounts().get(identity);
            if (account == null) throw new IllegalArgumentException("Unknown account: " + identity);
            if (normalizedLimit != null) account.setLimitCents(normalizedLimit);
            if (normalizedWebhook != null) account.setAlertWebhook(normalizedWebhook.isEmpty() ? null : normalizedWebhook);
        } else {
            KeyBudgetConfig key = next.getKeys().computeIfAbsent(identity, k -> new KeyBudgetConfig());
            if (normalizedLimit != null) key.setLimitCents(normalizedLimit);
            if (normalizedWebhook != null) key.setAlertWebhook(normalizedWebhook.isEmpty() ? null : normalizedWebhook);
        }
        write(next);
        install(next);
        log.info("Updated {} budget for '{}': limit={}, webhook {}", scope, identity,
            normalizedLimit == null ? "(unchanged)" : normalizedLimit,
            normalizedWebhook == null ? "unchanged" : (normalizedWebhook.isEmpty() ? "cleared" : "set"));
        return resolveBudget(scope, identity);
    }

    public void saveConfig() {
        write(snapshot.config);
    }

    private void write(FleetConfig config) {
        Path path = Paths.get(accountsPath);
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
                writer.write("# Provider accounts and budgets\n");
                writer.write("# limit_cents: budget limit in cents, or 'default' to use defaults.limit_cents\n");
                writer.write("# alert_webhook: optional URL for spending notifications\n\n");
                yamlMapper.writeValue(writer, config);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save accounts to " + path, e);
        }
    }

    private void install(FleetConfig next) {
        this.snapshot = new Snapshot(next, resolveAccounts(next));
    }

    private static List<FleetAccount> resolveAccounts(FleetConfig config) {
        List<FleetAccount> accounts = new ArrayList<>();
        for (Map.Entry<String, AccountConfig> entry : config.getAccounts().entrySet()) {
            AccountConfig account = entry.getValue();
            if (account == null || !hasText(account.getApiKey())) {
                log.error("Account '{}' has no api_key configured, skipping it", entry.getKey());
                continue;
            }
            accounts.add(FleetAccount.builder().name(entry.getKey()).apiKey(account.getApiKey()).build());
        }
        return List.copyOf(accounts);
    }

    private FleetConfig copyOf(FleetConfig config) {
        try {
            FleetConfig copy = yamlMapper.readValue(yamlMapper.writeValueAsBytes(config), FleetConfig.class);
            normalize(copy);
            return copy;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot copy account configuration", e);
        }
    }

    private static void normalize(FleetConfig loaded) {
        if (loaded.getDefaults() == null) loaded.setDefaults(new FleetConfig().getDefaults());
        if (loaded.getAccounts() == null) loaded.setAccounts(new FleetConfig().getAccounts());
        if (loaded.getKeys() == null) loaded.setKeys(new FleetConfig().getKeys());
    }

    private static boolean isDefault(String limit) {
        return limit == null || limit.isBlank() || BudgetPolicy.DEFAULT_LIMIT.equals(limit.trim().toLowerCase(Locale.ROOT));
    }

    private static long parseLimit(String limit, LedgerScope scope, String identity) {
        try {
            long cents = Long.parseLong(limit.trim());
            if (cents < 0) {
                throw new IllegalArgumentException("Negative limit for " + scope + " '" + identity + "': " + limit);
            }
            return cents;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed limit_cents for " + scope + " '" + identity + "': " + limit, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static final class Snapshot {
        private final FleetConfig config;
        private final List<FleetAccount> accounts;

        private Snapshot(FleetConfig config, List<FleetAccount> accounts) {
            this.config = config;
            this.accounts = accounts;
        }
    }
}
