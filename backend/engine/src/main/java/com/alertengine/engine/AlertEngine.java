package com.alertengine.engine;

import com.alertengine.core.bus.EventBus;
import com.alertengine.core.error.AlertEngineException;
import com.alertengine.core.error.NotFoundException;
import com.alertengine.core.events.AlertCreated;
import com.alertengine.core.events.AlertDeduplicated;
import com.alertengine.core.events.AlertNotified;
import com.alertengine.core.events.AlertSuppressed;
import com.alertengine.core.model.Alert;
import com.alertengine.core.model.AlertInsight;
import com.alertengine.core.model.AlertPattern;
import com.alertengine.core.model.AlertRule;
import com.alertengine.core.model.AlertStatus;
import com.alertengine.core.model.UserAlertPreferences;
import com.alertengine.engine.actions.ActionRecommender;
import com.alertengine.engine.api.AlertStore;
import com.alertengine.engine.api.NotificationGateway;
import com.alertengine.engine.background.AlertClusterer;
import com.alertengine.engine.background.BackgroundProcessor;
import com.alertengine.engine.background.ExpirySweeper;
import com.alertengine.engine.background.InsightReporter;
import com.alertengine.engine.background.ModelRefresher;
import com.alertengine.engine.background.TickReport;
import com.alertengine.engine.config.EngineSettings;
import com.alertengine.engine.dedup.Deduplicator;
import com.alertengine.engine.fatigue.FatigueDecision;
import com.alertengine.engine.fatigue.FatigueGuard;
import com.alertengine.engine.features.FeatureExtractor;
import com.alertengine.engine.features.RecentActivity;
import com.alertengine.engine.lifecycle.LifecycleManager;
import com.alertengine.engine.lifecycle.LifecycleResult;
import com.alertengine.engine.query.ActiveAlertQuery;
import com.alertengine.engine.query.AlertHistory;
import com.alertengine.engine.query.AlertQueryService;
import com.alertengine.engine.scoring.AlertScorer;
import com.alertengine.engine.scoring.BlendedScoringStrategy;
import com.alertengine.engine.scoring.FeedbackAdjuster;
import com.alertengine.engine.scoring.LearnedScoringStrategy;
import com.alertengine.engine.scoring.RuleBasedScoringStrategy;
import com.alertengine.engine.scoring.ScoreVector;
import com.alertengine.engine.scoring.ScoringContext;
import com.alertengine.engine.scoring.ScoringOutcome;
import com.alertengine.engine.scoring.ScoringStrategy;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the alert engine: creation pipeline, lifecycle actions, queries and the
 * background processor. Safe for concurrent use.
 */
public class AlertEngine {
    private static final Logger LOGGER = Logger.getLogger(AlertEngine.class.getName());

    public static final String RULE_ID_METADATA_KEY = "ruleId";

    private final AlertStore store;
    private final NotificationGateway notificationGateway;
    private final EventBus eventBus;
    private final Clock clock;
    private final EngineSettings settings;
    private final FeatureExtractor featureExtractor;
    private final LearnedScoringStrategy learnedScoring;
    private final BlendedScoringStrategy blendedScoring;
    private final AlertScorer scorer;
    private final Deduplicator deduplicator;
    private final FatigueGuard fatigueGuard;
    private final ActionRecommender actionRecommender;
    private final LifecycleManager lifecycle;
    private final AlertQueryService queries;
    private final InsightReporter insightReporter;
    private final BackgroundProcessor backgroundProcessor;
    private final EngineCounters counters = new EngineCounters();

    public AlertEngine(EngineContext context) {
        this(context, new RuleBasedScoringStrategy(), new LearnedScoringStrategy());
    }

    public AlertEngine(EngineContext context, ScoringStrategy ruleBasedScoring, LearnedScoringStrategy learnedScoring) {
        this.store = context.store();
        this.notificationGateway = context.notificationGateway();
        this.eventBus = context.eventBus();
        this.clock = context.clock();
        this.settings = context.settings();
        this.featureExtractor = new FeatureExtractor(clock);
        this.learnedScoring = learnedScoring;
        this.blendedScoring = new BlendedScoringStrategy(ruleBasedScoring, learnedScoring);
        FeedbackAdjuster adjuster = new FeedbackAdjuster(store, clock, settings.feedbackLookback(),
                settings.minFeedbackInteractions());
        this.scorer = new AlertScorer(blendedScoring, adjuster);
        this.deduplicator = new Deduplicator(store, clock, settings.dedupWindow());
        this.fatigueGuard = new FatigueGuard(store, clock, settings);
        this.actionRecommender = new ActionRecommender(context.actionAugmenter());
        this.lifecycle = new LifecycleManager(store, eventBus, clock);
        this.queries = new AlertQueryService(store, clock, settings);
        this.insightReporter = new InsightReporter(store, eventBus);
        this.backgroundProcessor = new BackgroundProcessor(
                List.of(
                        new AlertClusterer(store, eventBus, settings.clusterRadius(), settings.clusterMinSize()),
                        new ModelRefresher(store, learnedScoring, adjuster, settings.trainingRetention(),
                                settings.minTrainingSamples()),
                        new ExpirySweeper(store, lifecycle, deduplicator, settings.alertRetention()),
                        insightReporter
                ),
                eventBus,
                clock,
                settings.tickInterval()
        );
    }

    /**
     * Creates an alert, or returns the existing one when the same event was already seen inside the
     * deduplication window. An alert over the fatigue cap is persisted already dismissed and never
     * notified. Action augmentation and notification run after the fingerprint lock is released and
     * only for admitted alerts.
     */
    public Alert createAlert(CreateAlertCommand command) {
        command.validate();
        String fingerprint = Deduplicator.fingerprint(command.tenantId(), command.title(), command.sourceData());
        Admission admission = deduplicator.withFingerprintLock(fingerprint, () -> createLocked(command, fingerprint));
        if (!admission.admitted()) {
            return admission.alert();
        }
        Alert alert = withAugmentedActions(admission.alert());
        LOGGER.info("Alert created id=" + alert.alertId() + " tenant=" + alert.tenantId() + " category="
                + alert.category().value() + " priority=" + alert.priority().value());
        notifyRecipients(alert);
        return alert;
    }

    private Admission createLocked(CreateAlertCommand command, String fingerprint) {
        Optional<Alert> duplicate = deduplicator.findDuplicate(command.tenantId(), fingerprint);
        if (duplicate.isPresent()) {
            Alert repeated = deduplicator.recordRepeat(duplicate.get());
            counters.deduplicated.increment();
            eventBus.publish(new AlertDeduplicated(clock.instant(), repeated.tenantId(), repeated.alertId(),
                    repeated.similarAlertCount()));
            LOGGER.fine("Duplicate of " + repeated.alertId() + " count=" + repeated.similarAlertCount());
            return new Admission(repeated, false);
        }

        Instant now = clock.instant();
        RecentActivity activity = RecentActivity.from(
                store.alertsCreatedSince(command.tenantId(), now.minus(settings.dedupWindow())),
                command.title(),
                command.category());
        Map<String, Double> features = featureExtractor.extract(command.sourceData(), command.category(), activity);
        ScoringOutcome scored = scorer.score(new ScoringContext(command.tenantId(), command.category(), features,
                command.sourceData().size()));
        AlertRule rule = owningRule(command, now);
        FatigueDecision fatigue = fatigueGuard.admit(command.tenantId(), command.category(), rule, now);
        List<String> actions = actionRecommender.templateActions(command.category(), scored.scores());
        AlertStatus status = fatigue.suppressed() ? AlertStatus.DISMISSED : AlertStatus.ACTIVE;
        Alert alert = new Alert(
                deduplicator.allocateAlertId(fingerprint),
                fingerprint,
                command.tenantId(),
                rule.ruleId(),
                command.title(),
                command.message(),
                command.category(),
                scored.priority(),
                scored.scores().confidence(),
                scored.scores().severity(),
                scored.scores().urgency(),
                scored.scores().businessImpact(),
                status,
                fatigue.suppressed() ? fatigue.reason() : null,
                now,
                now,
                now.plus(settings.expiryFor(scored.priority())),
                null,
                command.metadata(),
                command.sourceData(),
                actions,
                0,
                features
        );
        try {
            store.saveAlert(alert);
        } catch (RuntimeException e) {
            fatigueGuard.release(command.tenantId(), command.category(), now);
            throw e;
        }
        deduplicator.remember(alert);
        counters.created.increment();
        bookkeeping("rule trigger " + rule.ruleId(), () -> store.updateRule(rule.ruleId(), r -> r.withTrigger(now)));
        eventBus.publish(new AlertCreated(now, alert.tenantId(), alert.alertId(), alert.category(),
                alert.priority(), alert.compositeScore()));

        if (fatigue.suppressed()) {
            counters.suppressed.increment();
            bookkeeping("suppression interaction " + alert.alertId(), () -> lifecycle.recordSuppression(alert));
            eventBus.publish(new AlertSuppressed(now, alert.tenantId(), alert.alertId(), alert.category(),
                    fatigue.alertsInWindow(), fatigue.dailyCap(), fatigue.reason()));
            return new Admission(alert, false);
        }
        return new Admission(alert, true);
    }

    private Alert withAugmentedActions(Alert alert) {
        if (!actionRecommender.canAugment()) {
            return alert;
        }
        ScoreVector scores = new ScoreVector(alert.confidence(), alert.severity(), alert.urgency(),
                alert.businessImpact());
        List<String> actions = actionRecommender.withAugmentation(alert.category(), alert.sourceData(), scores,
                alert.recommendedActions());
        if (actions.equals(alert.recommendedActions())) {
            return alert;
        }
        try {
            return store.updateAlert(alert.alertId(),
                    stored -> stored.withRecommendedActions(actions, stored.updatedAt())).orElse(alert);
        } catch (RuntimeException e) {
            counters.bookkeepingFailures.increment();
            LOGGER.log(Level.WARNING, "Failed to store augmented actions for alert " + alert.alertId(), e);
            return alert;
        }
    }

    public List<Alert> listActiveAlerts(ActiveAlertQuery query) {
        if (query.tenantId() == null || query.tenantId().isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        return queries.activeAlerts(query);
    }

    public Alert getAlert(String alertId) {
        return store.findAlert(alertId).orElseThrow(() -> new NotFoundException("Alert", alertId));
    }

    public LifecycleResult acknowledge(String alertId, String userId, String notes) {
        return lifecycle.acknowledge(alertId, requireUser(userId), notes);
    }

    public LifecycleResult dismiss(String alertId, String userId, String feedback, String reason) {
        return lifecycle.dismiss(alertId, requireUser(userId), feedback, reason);
    }

    public LifecycleResult resolve(String alertId, String userId, String notes) {
        return lifecycle.resolve(alertId, requireUser(userId), notes);
    }

    public LifecycleResult snooze(String alertId, String userId, Instant until, String reason) {
        return lifecycle.snooze(alertId, requireUser(userId), until, reason);
    }

    public LifecycleResult rate(String alertId, String userId, int rating, String comment) {
        return lifecycle.rate(alertId, requireUser(userId), rating, comment);
    }

    public LifecycleResult markViewed(String alertId, String userId) {
        return lifecycle.markViewed(alertId, requireUser(userId));
    }

    public BulkResult bulkAcknowledge(BulkRequest request) {
        return bulk(request, alertId -> lifecycle.acknowledge(alertId, request.userId(), request.note()));
    }

    public BulkResult bulkDismiss(BulkRequest request) {
        return bulk(request, alertId -> lifecycle.dismiss(alertId, request.userId(), request.note(), "bulk dismiss"));
    }

    /**
     * Stored preferences, or the defaults when the user never saved any. Defaults are not persisted.
     */
    public UserAlertPreferences getPreferences(String userId, String tenantId) {
        return store.findPreferences(requireUser(userId), requireTenant(tenantId))
                .orElseGet(() -> UserAlertPreferences.defaults(userId, tenantId, clock.instant()));
    }

    public UserAlertPreferences updatePreferences(UserAlertPreferences preferences) {
        requireUser(preferences.userId());
        requireTenant(preferences.tenantId());
        UserAlertPreferences stamped = new UserAlertPreferences(
                preferences.userId(),
                preferences.tenantId(),
                preferences.emailEnabled(),
                preferences.smsEnabled(),
                preferences.pushEnabled(),
                preferences.priorityThreshold(),
                preferences.quietHoursStart(),
                preferences.quietHoursEnd(),
                preferences.categoryEnabled(),
                preferences.frequencyLimits(),
                preferences.adaptiveLearningEnabled(),
                clock.instant()
        );
        store.savePreferences(stamped);
        LOGGER.info("Preferences updated user=" + stamped.userId() + " tenant=" + stamped.tenantId());
        return stamped;
    }

    /**
     * Creates or replaces a rule. Learned fields (feedback and trigger counts) survive replacement.
     */
    public AlertRule saveRule(AlertRule rule) {
        requireTenant(rule.tenantId());
        if (rule.category() == null) {
            throw new IllegalArgumentException("category is required");
        }
        Instant now = clock.instant();
        String ruleId = rule.ruleId() == null || rule.ruleId().isBlank()
                ? AlertRule.defaultRuleId(rule.tenantId(), rule.category())
                : rule.ruleId();
        synchronized (this) {
            Optional<AlertRule> existing = store.findRule(ruleId);
            if (existing.isPresent() && !existing.get().tenantId().equals(rule.tenantId())) {
                throw new IllegalArgumentException("rule " + ruleId + " belongs to another tenant");
            }
            AlertRule saved = new AlertRule(
                    ruleId,
                    rule.tenantId(),
                    rule.name() == null ? ruleId : rule.name(),
                    rule.category(),
                    rule.conditions(),
                    rule.thresholds(),
                    rule.enabled(),
                    rule.priorityWeight() > 0 ? rule.priorityWeight() : 1.0,
                    rule.dailyCap(),
                    existing.map(AlertRule::feedbackScore).orElse(AlertRule.INITIAL_FEEDBACK_SCORE),
                    existing.map(AlertRule::feedbackCount).orElse(0),
                    existing.map(AlertRule::triggerCount).orElse(0L),
                    existing.map(AlertRule::lastTriggeredAt).orElse(null),
                    existing.map(AlertRule::createdAt).orElse(now),
                    now
            );
            store.saveRule(saved);
            return saved;
        }
    }

    public List<AlertRule> listRules(String tenantId) {
        return store.rulesForTenant(requireTenant(tenantId));
    }

    public AlertHistory history(String tenantId, String userId, int days, int limit) {
        return queries.history(requireTenant(tenantId), userId, days, limit);
    }

    public List<AlertPattern> patterns(String tenantId) {
        return store.patternsForTenant(requireTenant(tenantId));
    }

    public Optional<AlertInsight> latestInsight(String tenantId) {
        return insightReporter.latest(tenantId);
    }

    public EngineHealth health() {
        TickReport last = backgroundProcessor.lastReport();
        boolean degraded = last != null && !last.success();
        return new EngineHealth(
                degraded ? "degraded" : "ok",
                learnedScoring.isModelLoaded(),
                learnedScoring.modelSampleCount(),
                backgroundProcessor.isRunning(),
                last == null ? null : last.startedAt(),
                last == null ? List.of() : last.failedSteps(),
                counters.snapshot(blendedScoring.degradations())
        );
    }

    public BackgroundProcessor backgroundProcessor() {
        return backgroundProcessor;
    }

    public void start() {
        backgroundProcessor.start();
    }

    public void stop() {
        backgroundProcessor.stop();
    }

    private AlertRule owningRule(CreateAlertCommand command, Instant now) {
        Object requested = command.metadata().get(RULE_ID_METADATA_KEY);
        if (requested instanceof String) {
            Optional<AlertRule> rule = store.findRule((String) requested)
                    .filter(candidate -> candidate.tenantId().equals(command.tenantId()));
            if (rule.isPresent()) {
                return rule.get();
            }
        }
        String ruleId = AlertRule.defaultRuleId(command.tenantId(), command.category());
        synchronized (this) {
            return store.findRule(ruleId).orElseGet(() -> {
                AlertRule created = AlertRule.defaultFor(command.tenantId(), command.category(), now);
                store.saveRule(created);
                return created;
            });
        }
    }

    private void notifyRecipients(Alert alert) {
        List<UserAlertPreferences> recipients = store.preferencesForTenant(alert.tenantId()).stream()
                .filter(prefs -> prefs.isCategoryEnabled(alert.category()))
                .filter(prefs -> alert.priority().isAtLeast(prefs.priorityThreshold()))
                .toList();
        try {
            Map<String, List<String>> delivered = notificationGateway.notify(alert, recipients);
            counters.notified.increment();
            eventBus.publish(new AlertNotified(clock.instant(), alert.tenantId(), alert.alertId(), alert.priority(),
                    delivered == null ? Map.of() : delivered));
        } catch (RuntimeException e) {
            counters.notificationFailures.increment();
            LOGGER.log(Level.WARNING, "Notification failed for alert " + alert.alertId(), e);
        }
    }

    private BulkResult bulk(BulkRequest request, Function<String, LifecycleResult> action) {
        requireTenant(request.tenantId());
        requireUser(request.userId());
        List<String> targets = request.alertIds().isEmpty()
                ? queries.activeAlerts(new ActiveAlertQuery(request.tenantId(), null, request.priority(),
                        request.category(), settings.maxListLimit())).stream().map(Alert::alertId).toList()
                : request.alertIds();
        List<String> changed = new ArrayList<>();
        List<String> unchanged = new ArrayList<>();
        Map<String, String> failed = new LinkedHashMap<>();
        for (String alertId : targets) {
            Optional<Alert> alert = store.findAlert(alertId)
                    .filter(candidate -> candidate.tenantId().equals(request.tenantId()));
            if (alert.isEmpty()) {
                failed.put(alertId, "Alert not found: " + alertId);
                continue;
            }
            try {
                LifecycleResult result = action.apply(alertId);
                (result.changed() ? changed : unchanged).add(alertId);
            } catch (AlertEngineException e) {
                failed.put(alertId, e.getMessage());
            }
        }
        LOGGER.info("Bulk action tenant=" + request.tenantId() + " changed=" + changed.size()
                + " unchanged=" + unchanged.size() + " failed=" + failed.size());
        return new BulkResult(targets.size(), changed, unchanged, failed);
    }

    private void bookkeeping(String what, Runnable step) {
        try {
            step.run();
        } catch (RuntimeException e) {
            counters.bookkeepingFailures.increment();
            LOGGER.log(Level.WARNING, "Failed to record " + what + " after the alert was stored", e);
        }
    }

    private static String requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return userId;
    }

    private static String requireTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId is required");
        }
        return tenantId;
    }

    private record Admission(Alert alert, boolean admitted) {
    }
}
