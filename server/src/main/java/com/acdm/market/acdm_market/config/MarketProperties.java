package com.acdm.market.acdm_market.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.acdm.market.acdm_market.entity.RootL2Policy;

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Market settings bound from the {@code market.*} keys of application.yml.
 * Native amounts are decimal strings in whole units ("0.00001"), converted to base units at startup.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "market")
public class MarketProperties {

    /** Pre-seeded referral root, its own sponsor. */
    private String rootAccount = "acdm-root";

    /** Account holding minted inventory and escrowed order tokens. */
    private String custodyAccount = "acdm-market";

    private String adminAccount = "acdm-admin";

    private String daoAccount = "acdm-dao";

    private String fallbackSink = "acdm-referral-reward-holder";

    private Duration roundDuration = Duration.ofDays(3);

    private String seedPrice = "0.00001";

    private String seedVolume = "1";

    private String priceIncrement = "0.000004";

    /** Decimals of the bundled in-memory token ledger. */
    private int tokenDecimals = 6;

    /** Upper bound for a single call waiting on the market executor. */
    private long callTimeoutMillis = 5_000;

    private Referral referral = new Referral();

    private Persistence persistence = new Persistence();

    private RateLimit rateLimit = new RateLimit();

    @Getter
    @Setter
    public static class Referral {
        private int saleL1 = 500;
        private int saleL2 = 300;
        private int tradeL1 = 250;
        private int tradeL2 = 250;
        private RootL2Policy rootL2Policy = RootL2Policy.PAY_ROOT;
    }

    @Getter
    @Setter
    public static class Persistence {
        /** Restore from and write through to MongoDB. */
        private boolean enabled = true;
        private String database = "acdm-market";
    }

    @Getter
    @Setter
    public static class RateLimit {
        /** Max burst requests. */
        private int capacity = 100;
        /** Requests per second. */
        private double refillRate = 10.0;
        private List<String> exemptedPaths = new ArrayList<>(List.of("/auth/"));
    }
}
