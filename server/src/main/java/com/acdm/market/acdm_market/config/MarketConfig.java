package com.acdm.market.acdm_market.config;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.acdm.market.acdm_market.cache.MarketStore;
import com.acdm.market.acdm_market.engine.MarketAdmin;
import com.acdm.market.acdm_market.engine.MarketContext;
import com.acdm.market.acdm_market.engine.MarketEngine;
import com.acdm.market.acdm_market.engine.MarketGenesis;
import com.acdm.market.acdm_market.engine.OrderBook;
import com.acdm.market.acdm_market.engine.PricingEngine;
import com.acdm.market.acdm_market.engine.ReferralRegistry;
import com.acdm.market.acdm_market.engine.RewardRouter;
import com.acdm.market.acdm_market.engine.RoundController;
import com.acdm.market.acdm_market.entity.ReferralRewardConfig;
import com.acdm.market.acdm_market.entity.Units;
import com.acdm.market.acdm_market.events.MarketEventPublisher;
import com.acdm.market.acdm_market.events.SpringMarketEventPublisher;
import com.acdm.market.acdm_market.execution.MarketExecutor;
import com.acdm.market.acdm_market.ledger.InMemoryPaymentGateway;
import com.acdm.market.acdm_market.ledger.InMemoryTokenLedger;
import com.acdm.market.acdm_market.ledger.PaymentGateway;
import com.acdm.market.acdm_market.ledger.TokenLedger;
import com.acdm.market.acdm_market.repositories.MarketStateRepository;
import com.acdm.market.acdm_market.repositories.OrderRepository;
import com.acdm.market.acdm_market.repositories.ReferralEdgeRepository;
import com.acdm.market.acdm_market.repositories.TokenBalanceRepository;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(MarketProperties.class)
public class MarketConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryTokenLedger tokenLedger(MarketProperties properties) {
        return new InMemoryTokenLedger(properties.getCustodyAccount(), properties.getTokenDecimals());
    }

    @Bean
    public PaymentGateway paymentGateway() {
        return new InMemoryPaymentGateway();
    }

    @Bean
    public PricingEngine pricingEngine(MarketProperties properties, TokenLedger tokenLedger) {
        return new PricingEngine(
                tokenLedger.decimals(),
                Units.parseNative(properties.getSeedPrice()),
                Units.parseNative(properties.getPriceIncrement()));
    }

    @Bean
    public ReferralRegistry referralRegistry() {
        return new ReferralRegistry();
    }

    @Bean
    public RewardRouter rewardRouter(ReferralRegistry referralRegistry, MarketProperties properties) {
        return new RewardRouter(referralRegistry, properties.getReferral().getRootL2Policy());
    }

    @Bean
    public RoundController roundController(PricingEngine pricingEngine, RewardRouter rewardRouter) {
        return new RoundController(pricingEngine, rewardRouter);
    }

    @Bean
    public OrderBook orderBook(RoundController roundController, PricingEngine pricingEngine,
            RewardRouter rewardRouter, TokenLedger tokenLedger) {
        return new OrderBook(roundController, pricingEngine, rewardRouter, tokenLedger);
    }

    @Bean
    public MarketAdmin marketAdmin() {
        return new MarketAdmin();
    }

    @Bean
    public MarketStore marketStore(MarketStateRepository marketStateRepository, OrderRepository orderRepository,
            ReferralEdgeRepository referralEdgeRepository, TokenBalanceRepository tokenBalanceRepository) {
        return new MarketStore(marketStateRepository, orderRepository, referralEdgeRepository,
                tokenBalanceRepository);
    }

    @Bean
    public MarketEventPublisher marketEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringMarketEventPublisher(applicationEventPublisher);
    }

    @Bean
    public MarketEngine marketEngine(MarketProperties properties, MarketStore marketStore, PricingEngine pricingEngine,
            InMemoryTokenLedger tokenLedger, PaymentGateway paymentGateway, Clock clock, RoundController roundController,
            OrderBook orderBook, ReferralRegistry referralRegistry, MarketAdmin marketAdmin,
            MarketEventPublisher marketEventPublisher) {
        MarketGenesis genesis = genesis(properties, pricingEngine);
        long now = clock.instant().getEpochSecond();

        boolean persistent = properties.getPersistence().isEnabled();
        MarketContext context = persistent
                ? marketStore.loadOrCreate(properties.getRootAccount(), properties.getCustodyAccount(),
                        () -> genesis.create(now))
                : genesis.create(now);
        if (persistent) {
            marketStore.restoreLedger(tokenLedger, context);
        }

        MarketEngine engine = new MarketEngine(context, tokenLedger, paymentGateway, clock, roundController,
                orderBook, referralRegistry, marketAdmin, marketEventPublisher);
        if (persistent) {
            engine.addCommitListener(marketStore);
        }
        log.info("Market engine ready: root={}, custody={}, roundDuration={}s, persistence={}",
                properties.getRootAccount(), properties.getCustodyAccount(),
                properties.getRoundDuration().getSeconds(), persistent);
        return engine;
    }

    @Bean(destroyMethod = "close")
    public MarketExecutor marketExecutor(MarketProperties properties) {
        return new MarketExecutor(properties.getCallTimeoutMillis());
    }

    private static MarketGenesis genesis(MarketProperties properties, PricingEngine pricingEngine) {
        MarketProperties.Referral referral = properties.getReferral();
        return MarketGenesis.builder()
                .rootAccount(properties.getRootAccount())
                .custodyAccount(properties.getCustodyAccount())
                .adminAccount(properties.getAdminAccount())
                .daoAccount(properties.getDaoAccount())
                .fallbackSink(properties.getFallbackSink())
                .seedPrice(pricingEngine.getSeedPrice())
                .seedVolume(Units.parseNative(properties.getSeedVolume()))
                .roundDuration(properties.getRoundDuration().getSeconds())
                .rewardConfig(ReferralRewardConfig.builder()
                        .saleL1(referral.getSaleL1())
                        .saleL2(referral.getSaleL2())
                        .tradeL1(referral.getTradeL1())
                        .tradeL2(referral.getTradeL2())
                        .build())
                .build();
    }
}
