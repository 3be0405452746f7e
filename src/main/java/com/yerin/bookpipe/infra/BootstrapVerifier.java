package com.yerin.bookpipe.infra;

import com.yerin.bookpipe.config.BookpipeProperties;
import com.yerin.bookpipe.domain.JobStateStore;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Fails the application context when the service could not run safely.
 * Workers start only after this bean is initialized.
 */
@Slf4j
@Component("bootstrapVerifier")
@RequiredArgsConstructor
public class BootstrapVerifier {

    private final JobStateStore stateStore;
    private final BookpipeProperties properties;

    @PostConstruct
    public void verify() {
        String apiKey = properties.getGateway().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("bookpipe.gateway.api-key (API_KEY) is not configured");
        }

        Duration leaseTtl = properties.getWorker().getLeaseTtl();
        Duration stageTimeout = properties.getWorker().getStageTimeout();
        if (leaseTtl.compareTo(stageTimeout) <= 0) {
            throw new IllegalStateException("bookpipe.worker.lease-ttl (" + leaseTtl
                    + ") must be longer than bookpipe.worker.stage-timeout (" + stageTimeout + ")");
        }

        if (!stateStore.ping()) {
            throw new IllegalStateException("state store is unreachable at startup");
        }
        log.info("[Bootstrap] verified: state store reachable, leaseTtl={}, stageTimeout={}", leaseTtl, stageTimeout);
    }
}
