package com.tapas.orderstream.monitor.config;

import com.tapas.orderstream.common.cli.CliUsageFailureAnalyzer;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

@Order(Ordered.HIGHEST_PRECEDENCE)
public class MonitorUsageFailureAnalyzer extends CliUsageFailureAnalyzer {

    @Override
    protected String usage() {
        return """
                Usage: monitor-service --topic=<name> [options]
                  --bootstrap-servers=<host:port,...>   default localhost:9092,localhost:9094
                  --group-id=<id>                       consumer group (default order-tracker)
                  --commit-every=<n>                    commit after n processed records, 0 = only at
                                                        revocation and shutdown (default 100)
                  --max-records=<n>                     stop after n records, 0 = no limit
                  --report-every-seconds=<n>            metrics line interval (default 5)
                  --poll-timeout-ms=<ms>                longest wait of one poll (default 1000)
                  --broker-timeout-ms=<ms>              bound of one broker check (default 10000)
                  --idle-polls-before-broker-check=<n>  empty polls before the broker is checked
                                                        again (default 30)""";
    }
}
