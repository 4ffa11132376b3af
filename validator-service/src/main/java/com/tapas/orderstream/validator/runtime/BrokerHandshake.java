package com.tapas.orderstream.validator.runtime;

import com.tapas.orderstream.common.error.BrokerConnectionException;
import com.tapas.orderstream.common.retry.RetryProperties;
import com.tapas.orderstream.common.retry.RetryTemplates;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.errors.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Asks the cluster to describe itself, with bounded retries. The listener container
 * only logs warnings while the broker is down, so this is what turns an unreachable
 * cluster into a {@link BrokerConnectionException}.
 */
public class BrokerHandshake {

    private static final Logger log = LoggerFactory.getLogger(BrokerHandshake.class);

    private final Supplier<Admin> adminFactory;
    private final Duration timeout;
    private final int maxAttempts;
    private final RetryTemplate retry;

    public BrokerHandshake(Supplier<Admin> adminFactory, Duration timeout, RetryProperties retryProperties) {
        this.adminFactory = adminFactory;
        this.timeout = timeout;
        this.maxAttempts = retryProperties.getMaxAttempts();
        this.retry = RetryTemplates.exponential("broker check", retryProperties, List.of(KafkaException.class));
    }

    /**
     * @return the number of broker nodes that answered
     * @throws BrokerConnectionException once every attempt has failed
     */
    public int verify() {
        Admin admin = adminFactory.get();
        try {
            Collection<Node> nodes = retry.execute(ctx -> describeCluster(admin));
            log.debug("Broker reachable, {} node(s)", nodes.size());
            return nodes.size();
        } catch (KafkaException e) {
            throw new BrokerConnectionException("Broker unreachable after " + maxAttempts + " attempts", e);
        } finally {
            admin.close(Duration.ZERO);
        }
    }

    private Collection<Node> describeCluster(Admin admin) {
        DescribeClusterOptions options = new DescribeClusterOptions().timeoutMs((int) timeout.toMillis());
        try {
            return admin.describeCluster(options).nodes().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof KafkaException) {
                throw (KafkaException) e.getCause();
            }
            throw new KafkaException("Describing the cluster failed", e.getCause());
        } catch (java.util.concurrent.TimeoutException e) {
            throw new TimeoutException("No answer from the cluster within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while checking the broker", e);
        }
    }
}
