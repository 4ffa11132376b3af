package com.tapas.orderstream.publisher.config;

import com.tapas.orderstream.common.cli.CliUsageFailureAnalyzer;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

@Order(Ordered.HIGHEST_PRECEDENCE)
public class PublisherUsageFailureAnalyzer extends CliUsageFailureAnalyzer {

    @Override
    protected String usage() {
        return """
                Usage: publisher-service --topic=<name> [options]
                  --bootstrap-servers=<host:port,...>   default localhost:9092,localhost:9094
                  --events-per-second=<rate>            target rate, > 0 (default 10)
                  --duration-seconds=<n>                stop after n seconds, 0 = no limit
                  --max-events=<n>                      stop after n events, 0 = no limit
                  --report-every-seconds=<n>            metrics line interval (default 5)
                  --drain-timeout-ms=<n>                wait for pending acks at shutdown (default 10000)
                  --invalid=true                        publish deliberately invalid events
                  --invalid-mode=<mode>                 corruption strategy, implies --invalid:
                                                        missing_quantity, missing_price, missing_both,
                                                        non_positive, non_positive_quantity,
                                                        non_positive_price, random (default random)
                  --provision-topic=true                create the topic if it does not exist
                  --partitions=<n>                      partitions of a provisioned topic (default 6)
                  --replication-factor=<n>              replication of a provisioned topic (default 2)""";
    }
}
