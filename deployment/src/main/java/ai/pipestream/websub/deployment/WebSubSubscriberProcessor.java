package ai.pipestream.websub.deployment;

import ai.pipestream.websub.ServiceConfigurationCollector;
import ai.pipestream.websub.SubscriptionOrchestrator;
import ai.pipestream.websub.SubscriptionReadinessCheck;
import ai.pipestream.websub.WebSubSubscriptionManager;
import ai.pipestream.websub.callback.CallbackUrlResolver;
import ai.pipestream.websub.callback.PathSegmentGenerator;
import ai.pipestream.websub.client.WebSubClientProducer;
import ai.pipestream.websub.discovery.ResourceDiscoveryClient;
import ai.pipestream.websub.events.LoggingSubscriptionEventListener;
import ai.pipestream.websub.hub.SubscriptionClient;
import ai.pipestream.websub.listener.ConfiguredSubscriberListener;
import io.quarkus.arc.deployment.AdditionalBeanBuildItem;
import io.quarkus.deployment.annotations.BuildProducer;
import io.quarkus.deployment.annotations.BuildStep;
import io.quarkus.deployment.builditem.FeatureBuildItem;
import io.quarkus.deployment.builditem.IndexDependencyBuildItem;

/**
 * Quarkus deployment processor for the WebSub subscriber extension.
 *
 * <p>Registers the extension's beans; they stay unremovable because nothing in the
 * application injects most of them.
 */
public class WebSubSubscriberProcessor {

    private static final String FEATURE = "pipestream-websub-subscriber";
    private static final String GROUP_ID = "ai.pipestream";
    private static final String ARTIFACT_ID = "pipestream-websub-subscriber";

    @BuildStep
    FeatureBuildItem feature() {
        return new FeatureBuildItem(FEATURE);
    }

    @BuildStep
    void indexDependencies(BuildProducer<IndexDependencyBuildItem> indexDependencies) {
        indexDependencies.produce(new IndexDependencyBuildItem(GROUP_ID, ARTIFACT_ID));
    }

    @BuildStep
    AdditionalBeanBuildItem registerBeans() {
        return AdditionalBeanBuildItem.builder()
                .addBeanClasses(
                        WebSubSubscriptionManager.class,
                        ServiceConfigurationCollector.class,
                        SubscriptionOrchestrator.class,
                        SubscriptionReadinessCheck.class,
                        CallbackUrlResolver.class,
                        PathSegmentGenerator.class,
                        WebSubClientProducer.class,
                        ResourceDiscoveryClient.class,
                        SubscriptionClient.class,
                        ConfiguredSubscriberListener.class,
                        LoggingSubscriptionEventListener.class
                )
                .setUnremovable()
                .build();
    }
}
