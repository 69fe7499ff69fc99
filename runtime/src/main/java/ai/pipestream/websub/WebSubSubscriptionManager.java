package ai.pipestream.websub;

import ai.pipestream.websub.callback.CallbackUrlResolver;
import ai.pipestream.websub.config.WebSubSubscriberConfig;
import ai.pipestream.websub.exception.ConfigurationException;
import ai.pipestream.websub.exception.WebSubException;
import ai.pipestream.websub.hub.SubscriptionClient;
import ai.pipestream.websub.listener.SubscriberListener;
import ai.pipestream.websub.model.CallbackUrl;
import ai.pipestream.websub.model.ServiceConfiguration;
import ai.pipestream.websub.model.SubscriptionOutcome;
import ai.pipestream.websub.model.SubscriptionState;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntConsumer;

/**
 * Owns the subscription lifecycle of the services attached to the listener.
 *
 * <p>On startup every configured service is attached, its callback URL resolved once,
 * and one subscription run started per service. Runs are independent and concurrent.
 * A service that cannot be attached or subscribed is marked failed without holding
 * back the others. The failure then stops the application, unless
 * {@code pipestream.websub.required=false}, in which case it is logged and kept
 * for {@link #getStartupFailure()}.
 */
@ApplicationScoped
public class WebSubSubscriptionManager {

    private static final Logger LOG = Logger.getLogger(WebSubSubscriptionManager.class);
    private static final Duration UNSUBSCRIBE_TIMEOUT = Duration.ofSeconds(10);

    private final WebSubSubscriberConfig config;
    private final ServiceConfigurationCollector collector;
    private final SubscriberListener listener;
    private final CallbackUrlResolver callbackUrlResolver;
    private final SubscriptionOrchestrator orchestrator;
    private final SubscriptionClient subscriptionClient;

    private final Map<String, AttachedService> attached = Collections.synchronizedMap(new LinkedHashMap<>());
    private final ConcurrentMap<String, SubscriptionState> states = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SubscriptionOutcome> outcomes = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> failures = new ConcurrentHashMap<>();
    private final AtomicReference<Throwable> startupFailure = new AtomicReference<>();

    IntConsumer exit = Quarkus::asyncExit;

    @Inject
    public WebSubSubscriptionManager(WebSubSubscriberConfig config,
                                     ServiceConfigurationCollector collector,
                                     SubscriberListener listener,
                                     CallbackUrlResolver callbackUrlResolver,
                                     SubscriptionOrchestrator orchestrator,
                                     SubscriptionClient subscriptionClient) {
        this.config = config;
        this.collector = collector;
        this.listener = listener;
        this.callbackUrlResolver = callbackUrlResolver;
        this.orchestrator = orchestrator;
        this.subscriptionClient = subscriptionClient;
    }

    void onStart(@Observes StartupEvent ev) {
        if (!config.enabled()) {
            LOG.info("WebSub subscriptions are disabled");
            return;
        }

        startupFailure.set(null);
        List<Throwable> attachFailures = new ArrayList<>();
        for (String name : new TreeSet<>(config.services().keySet())) {
            try {
                attach(collector.collect(name));
            } catch (WebSubException e) {
                LOG.errorf("WebSub service %s could not be attached: %s", name, e.getMessage());
                recordFailure(name, e);
                attachFailures.add(e);
            }
        }
        listener.start();

        LOG.infof("Starting WebSub subscriptions for %d service(s)", attached.size());
        subscribeAll().subscribe().with(
                results -> {
                    if (attachFailures.isEmpty()) {
                        LOG.infof("WebSub subscriptions finished: %s", getStates());
                    } else {
                        handleStartupFailure(attachFailures.get(0));
                    }
                },
                failure -> handleStartupFailure(attachFailures.isEmpty() ? failure : attachFailures.get(0))
        );
    }

    void onStop(@Observes ShutdownEvent ev) {
        if (!config.enabled()) {
            return;
        }
        if (config.unsubscribeOnShutdown()) {
            unsubscribeAll();
        }
        List<String> names;
        synchronized (attached) {
            names = new ArrayList<>(attached.keySet());
            attached.clear();
        }
        names.forEach(listener::detach);
        LOG.info("Shutting down WebSub listener");
        listener.gracefulStop();
    }

    /**
     * Attaches a service to the listener and resolves its callback URL.
     *
     * @param service the service configuration
     * @return the callback URL the service is reachable at
     * @throws ai.pipestream.websub.exception.ListenerAttachException if the listener refuses the service
     */
    public CallbackUrl attach(ServiceConfiguration service) {
        CallbackUrl callbackUrl = callbackUrlResolver.resolve(service.getName(), service.getPath(), listener);
        listener.attach(service.getName(), callbackUrl.getPath());
        attached.put(service.getName(), new AttachedService(service, callbackUrl));
        states.put(service.getName(), SubscriptionState.PENDING);
        outcomes.remove(service.getName());
        failures.remove(service.getName());
        LOG.infof("Attached WebSub service %s at %s", service.getName(), callbackUrl);
        return callbackUrl;
    }

    /**
     * Subscribes every attached service.
     *
     * @return a Uni emitting the outcomes in attach order once every run has finished,
     *         or failing with the first failure in attach order
     */
    public Uni<List<SubscriptionOutcome>> subscribeAll() {
        List<AttachedService> services;
        synchronized (attached) {
            services = new ArrayList<>(attached.values());
        }
        if (services.isEmpty()) {
            return Uni.createFrom().item(Collections.<SubscriptionOutcome>emptyList());
        }

        List<Uni<RunResult>> runs = new ArrayList<>();
        for (AttachedService service : services) {
            runs.add(run(service));
        }

        return Uni.join().all(runs).andFailFast()
                .onItem().transformToUni(results -> {
                    List<SubscriptionOutcome> completed = new ArrayList<>();
                    for (RunResult result : results) {
                        if (result.failure() != null) {
                            return Uni.createFrom().<List<SubscriptionOutcome>>failure(result.failure());
                        }
                        completed.add(result.outcome());
                    }
                    return Uni.createFrom().<List<SubscriptionOutcome>>item(completed);
                });
    }

    /**
     * Subscribes one attached service.
     *
     * @throws ConfigurationException (as failure) if the service is not attached
     */
    public Uni<SubscriptionOutcome> subscribe(String serviceName) {
        AttachedService service = attached.get(serviceName);
        if (service == null) {
            return Uni.createFrom().failure(new ConfigurationException(serviceName, "service is not attached"));
        }
        return run(service).onItem().transformToUni(result -> result.failure() != null
                ? Uni.createFrom().<SubscriptionOutcome>failure(result.failure())
                : Uni.createFrom().item(result.outcome()));
    }

    private Uni<RunResult> run(AttachedService service) {
        String name = service.configuration().getName();
        return orchestrator.subscribe(service.configuration(), service.callbackUrl(), states::put)
                .onItem().invoke(outcome -> {
                    outcomes.put(name, outcome);
                    states.put(name, outcome.isAccepted() ? SubscriptionState.ACCEPTED : SubscriptionState.SKIPPED);
                })
                .onFailure().invoke(failure -> recordFailure(name, failure))
                .onItem().transform(RunResult::succeeded)
                .onFailure().recoverWithItem(RunResult::failed);
    }

    /**
     * Cancels every accepted subscription at its hub. Failures are logged, not propagated.
     */
    public void unsubscribeAll() {
        Map<String, SubscriptionOutcome> accepted = new TreeMap<>(outcomes);
        for (Map.Entry<String, SubscriptionOutcome> entry : accepted.entrySet()) {
            SubscriptionOutcome outcome = entry.getValue();
            if (!outcome.isAccepted()) {
                continue;
            }
            AttachedService service = attached.get(entry.getKey());
            if (service == null) {
                continue;
            }
            try {
                LOG.infof("Unsubscribing service %s from %s at hub %s", entry.getKey(), outcome.topic(), outcome.hub());
                subscriptionClient.unsubscribe(outcome.hub(), outcome.topic(), outcome.callback(),
                                service.configuration().getSubscriptionTransport())
                        .await().atMost(UNSUBSCRIBE_TIMEOUT);
                outcomes.remove(entry.getKey());
                states.put(entry.getKey(), SubscriptionState.UNSUBSCRIBED);
            } catch (Exception e) {
                LOG.warnf(e, "Failed to unsubscribe service %s", entry.getKey());
            }
        }
    }

    private void recordFailure(String name, Throwable failure) {
        failures.put(name, String.valueOf(failure.getMessage()));
        states.put(name, SubscriptionState.FAILED);
    }

    private void handleStartupFailure(Throwable failure) {
        startupFailure.set(failure);
        if (config.required()) {
            LOG.errorf(failure, "WebSub subscription required but failed, stopping application. States: %s", getStates());
            exit.accept(1);
        } else {
            LOG.errorf(failure, "WebSub subscription failed; affected services stay attached but unsubscribed. States: %s",
                    getStates());
        }
    }

    /**
     * Returns the subscription state of a service, or null if it was never attached.
     */
    public SubscriptionState getState(String serviceName) {
        return states.get(serviceName);
    }

    /**
     * Returns the states of all known services, ordered by name.
     */
    public Map<String, SubscriptionState> getStates() {
        return Collections.unmodifiableMap(new TreeMap<>(states));
    }

    public Optional<SubscriptionOutcome> getOutcome(String serviceName) {
        return Optional.ofNullable(outcomes.get(serviceName));
    }

    /**
     * Returns the failure message of a service's last run, if it failed.
     */
    public Optional<String> getFailure(String serviceName) {
        return Optional.ofNullable(failures.get(serviceName));
    }

    /**
     * Returns the failure reported by the last startup, if any service could not be attached or subscribed.
     */
    public Optional<Throwable> getStartupFailure() {
        return Optional.ofNullable(startupFailure.get());
    }

    public Optional<CallbackUrl> getCallbackUrl(String serviceName) {
        AttachedService service = attached.get(serviceName);
        return service != null ? Optional.of(service.callbackUrl()) : Optional.empty();
    }

    private record AttachedService(ServiceConfiguration configuration, CallbackUrl callbackUrl) {
    }

    private record RunResult(SubscriptionOutcome outcome, Throwable failure) {

        static RunResult succeeded(SubscriptionOutcome outcome) {
            return new RunResult(outcome, null);
        }

        static RunResult failed(Throwable failure) {
            return new RunResult(null, failure);
        }
    }
}
