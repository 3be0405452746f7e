package com.yerin.bookpipe.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code bookpipe.*}. Environment variables of the container are mapped onto
 * these keys in {@code application.yml}.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "bookpipe")
public class BookpipeProperties {

    @Valid
    private Gateway gateway = new Gateway();
    @Valid
    private Worker worker = new Worker();
    @Valid
    private Retry retry = new Retry();
    @Valid
    private Pipeline pipeline = new Pipeline();
    @Valid
    private Client client = new Client();
    @Valid
    private Storage storage = new Storage();
    @Valid
    private State state = new State();
    @Valid
    private Health health = new Health();

    @Getter
    @Setter
    public static class Gateway {
        @NotBlank(message = "bookpipe.gateway.api-key (API_KEY) 는 필수입니다.")
        private String apiKey;
        private String apiKeyHeader = "X-API-Key";
        private DataSize maxInputSize = DataSize.ofMegabytes(50);
        /** Connect and read timeout for sources submitted by URL. */
        private Duration fetchTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
        @Min(1)
        private int concurrency = 2;
        @Min(1)
        private int batchSize = 20;
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration leaseTtl = Duration.ofSeconds(60);
        private Duration stageTimeout = Duration.ofSeconds(30);
        @Min(1)
        private int reaperBatchSize = 100;
        /** Read by {@code LeaseReaper}'s schedule through a placeholder. */
        @Min(1)
        private long reaperIntervalMillis = 2000;
    }

    @Getter
    @Setter
    public static class Retry {
        private Duration baseBackoff = Duration.ofSeconds(1);
        private Duration backoffCap = Duration.ofSeconds(60);
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterRatio = 0.2;
    }

    @Getter
    @Setter
    public static class Pipeline {
        @NotEmpty
        private List<String> stages = new ArrayList<>(List.of("ingest", "convert", "validate", "package", "publish"));
        @Min(1)
        private int maxAttempts = 3;
        private Map<String, Integer> stageMaxAttempts = new HashMap<>();

        public int maxAttemptsFor(String stage) {
            Integer override = stage == null ? null : stageMaxAttempts.get(stage);
            return override != null && override > 0 ? override : maxAttempts;
        }
    }

    /** Retry policy of the Redis / object-store adapters for transient I/O errors. */
    @Getter
    @Setter
    public static class Client {
        @Min(1)
        private int maxAttempts = 3;
        private Duration baseBackoff = Duration.ofMillis(200);
        private Duration backoffCap = Duration.ofSeconds(2);
    }

    @Getter
    @Setter
    public static class Storage {
        private String endpoint;
        private String region = "oss-cn-hangzhou";
        @NotBlank(message = "bookpipe.storage.bucket (ALIYUN_OSS_BUCKET_NAME) 는 필수입니다.")
        private String bucket;
        private String accessKey;
        private String secretKey;
        private String pathPrefix = "books";
        private boolean pathStyleAccess = false;
    }

    @Getter
    @Setter
    public static class State {
        private String keyPrefix = "bookpipe";
        private Duration retention = Duration.ofDays(7);
    }

    @Getter
    @Setter
    public static class Health {
        private Duration timeout = Duration.ofSeconds(2);
    }
}
