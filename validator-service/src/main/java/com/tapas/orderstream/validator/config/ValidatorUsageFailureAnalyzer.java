package com.tapas.orderstream.validator.config;

import com.tapas.orderstream.common.cli.CliUsageFailureAnalyzer;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

@Order(Ordered.HIGHEST_PRECEDENCE)
public class ValidatorUsageFailureAnalyzer extends CliUsageFailureAnalyzer {

    @Override
    protected String usage() {
        return """
                Usage: validator-service --topic=<name> [options]
                  --bootstrap-servers=<host:port,...>   default localhost:9092,localhost:9094
                  --group-id=<id>                       consumer group (default order-validator)
                  --sink-dir=<path>                     root of the valid/ and invalid/ sinks (default data/sink)
                  --checkpoint-dir=<path>               root of the checkpoint markers (default data/checkpoints)
                  --max-batch-records=<n>               records per micro-batch, > 0 (default 500)
                  --trigger-interval-ms=<n>             pause between micro-batches (default 1000)
                  --report-every-seconds=<n>            metrics line interval (default 5)
                  --broker-timeout-ms=<ms>              bound of one broker check (default 10000)
                  --broker-check-interval-ms=<ms>       idle time before the broker is checked again
                                                        (default 30000)""";
    }
}
