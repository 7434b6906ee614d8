package io.podcontroller;

import io.etcd.jetcd.Client;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.podcontroller.config.ControllerConfig;
import io.podcontroller.labels.Applicator;
import io.podcontroller.labels.EtcdApplicator;
import io.podcontroller.labels.HttpApplicator;
import io.podcontroller.lock.EtcdLocker;
import io.podcontroller.lock.Locker;
import io.podcontroller.metrics.MetricsProvider;
import io.podcontroller.rc.ReplicationControllerFarm;
import io.podcontroller.rc.store.EtcdRcStore;
import io.podcontroller.rc.store.RcStore;
import io.podcontroller.scheduler.ApplicatorScheduler;
import io.podcontroller.scheduler.Scheduler;
import io.podcontroller.status.WatchStatusTracker;
import io.podcontroller.store.EtcdOperations;
import io.podcontroller.store.EtcdPodStore;
import io.podcontroller.store.PodStore;
import io.podcontroller.store.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Duration;

/**
 * Main Spring Boot application class for the replication controller.
 *
 * Runs one reconciliation loop per replication controller record found in etcd, for the
 * records this process holds the lock of.
 */
@Slf4j
@SpringBootApplication
public class ReplicationControllerApplication {

    public static void main(String[] args) {
        log.info("Starting Replication Controller Application");

        try {
            SpringApplication.run(ReplicationControllerApplication.class, args);
            log.info("Replication Controller started successfully");

        } catch (Exception e) {
            log.error("Failed to start Replication Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    public ControllerConfig config() {
        ControllerConfig config = new ControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean(destroyMethod = "close")
    public Client etcdClient(ControllerConfig config) {
        log.info("Connecting to etcd at {}", String.join(", ", config.getEtcdEndpoints()));
        return Client.builder().endpoints(config.getEtcdEndpoints()).build();
    }

    @Bean
    public EtcdOperations etcdOperations(Client etcdClient) {
        return new EtcdOperations(etcdClient.getKVClient(), etcdClient.getWatchClient());
    }

    @Bean
    public PodStore podStore(EtcdOperations etcdOperations, ControllerConfig config) {
        log.info("Initializing EtcdPodStore");
        return new EtcdPodStore(etcdOperations, new RetryPolicy(config.getStoreRetries()));
    }

    /**
     * Applicator for pod and replication controller labels, always backed by etcd.
     */
    @Bean
    @Primary
    public Applicator labelApplicator(EtcdOperations etcdOperations, ControllerConfig config) {
        log.info("Initializing EtcdApplicator with {} retries", config.getLabelRetries());
        return new EtcdApplicator(etcdOperations, new RetryPolicy(config.getLabelRetries()));
    }

    /**
     * Applicator the scheduler reads node labels from: the node inventory service when one
     * is configured, etcd otherwise.
     */
    @Bean
    public Applicator nodeApplicator(Applicator labelApplicator, ControllerConfig config) {
        if (config.getNodeEndpoint() == null) {
            log.info("No node inventory endpoint configured, scheduling from etcd node labels");
            return labelApplicator;
        }
        log.info("Scheduling from node inventory at {}", config.getNodeEndpoint());
        return new HttpApplicator(config.getNodeEndpoint(), config.getNodeEndpointHeaders(),
            new RetryPolicy(config.getLabelRetries()), Duration.ofSeconds(config.getWatchIntervalSeconds()));
    }

    @Bean
    public Scheduler scheduler(@Qualifier("nodeApplicator") Applicator nodeApplicator) {
        log.info("Initializing ApplicatorScheduler");
        return new ApplicatorScheduler(nodeApplicator);
    }

    @Bean
    public RcStore rcStore(EtcdOperations etcdOperations, Applicator labelApplicator, PodStore podStore,
                           ControllerConfig config) {
        log.info("Initializing EtcdRcStore with {} retries", config.getStoreRetries());
        return new EtcdRcStore(etcdOperations, new RetryPolicy(config.getStoreRetries()), labelApplicator,
            podStore);
    }

    @Bean
    public Locker locker(Client etcdClient, ControllerConfig config) {
        return new EtcdLocker(etcdClient, config.getLockTtlSeconds());
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public MetricsProvider metricsProvider(MeterRegistry meterRegistry, ControllerConfig config) {
        return new MetricsProvider(meterRegistry, config.getControllerId());
    }

    @Bean
    public WatchStatusTracker watchStatusTracker(MetricsProvider metricsProvider) {
        return new WatchStatusTracker(metricsProvider);
    }

    /**
     * The farm starts its loops once constructed and stops them, releasing their locks,
     * when the context closes.
     */
    @Bean
    public ReplicationControllerFarm replicationControllerFarm(
            RcStore rcStore,
            Scheduler scheduler,
            PodStore podStore,
            Applicator labelApplicator,
            Locker locker,
            WatchStatusTracker watchStatusTracker,
            MetricsProvider metricsProvider,
            ControllerConfig config) {
        log.info("Initializing ReplicationControllerFarm for controller {}", config.getControllerId());
        return new ReplicationControllerFarm(rcStore, scheduler, podStore, labelApplicator, locker,
            watchStatusTracker, metricsProvider, Duration.ofSeconds(config.getWatchIntervalSeconds()));
    }
}
