package com.nosota.lingodesk.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Application settings bound from the {@code lingodesk.*} namespace.
 */
@ConfigurationProperties(prefix = "lingodesk")
@Getter
@Setter
public class LingodeskProperties {

    /**
     * Public URL of the application, used to build links in e-mails.
     */
    private String baseUrl = "http://localhost:8080";

    /**
     * Credits granted to a newly registered account.
     */
    private long signupCredits = 5000;

    private Mail mail = new Mail();
    private Tokens tokens = new Tokens();
    private TwoFactor twoFactor = new TwoFactor();
    private Upload upload = new Upload();
    private Orders orders = new Orders();
    private Bootstrap bootstrap = new Bootstrap();

    @Getter
    @Setter
    public static class Mail {
        private String from = "noreply@lingodesk.local";
    }

    @Getter
    @Setter
    public static class Tokens {
        private Duration emailVerificationTtl = Duration.ofHours(24);
        private Duration passwordResetTtl = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class TwoFactor {
        private String issuer = "LingoDesk";

        /**
         * Number of 30 second steps accepted on each side of the current one.
         */
        private int window = 1;
    }

    @Getter
    @Setter
    public static class Upload {
        private DataSize maxFileSize = DataSize.ofMegabytes(10);
    }

    @Getter
    @Setter
    public static class Orders {
        /**
         * When true, only forward moves along the pipeline are accepted.
         */
        private boolean strictTransitions = false;

        private Duration estimatedCompletion = Duration.ofDays(1);
    }

    @Getter
    @Setter
    public static class Bootstrap {
        private Admin admin = new Admin();
    }

    @Getter
    @Setter
    public static class Admin {
        private String email;
        private String password;
        private String accountName = "LingoDesk";
    }
}
