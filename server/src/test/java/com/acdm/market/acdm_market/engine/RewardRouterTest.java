package com.acdm.market.acdm_market.engine;

import com.acdm.market.acdm_market.entity.RootL2Policy;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RewardRouterTest {

    private static final String ROOT = "root";
    private static final String SINK = "sink";

    private final StubGraph graph = new StubGraph()
            .edge(ROOT, ROOT)
            .edge("bob", ROOT)
            .edge("carol", "bob");

    @Test
    void rewardsAndNetAlwaysAddUpToTheBase() {
        int[] rates = {0, 1, 250, 500, 3333, 5000, 9999, 10000};
        List<BigInteger> bases = List.of(BigInteger.ZERO, BigInteger.ONE, BigInteger.valueOf(7),
                BigInteger.valueOf(9999), new BigInteger("1000000000000000007"));
        List<String> principals = List.of("stranger", "bob", "carol", ROOT);

        for (RootL2Policy policy : RootL2Policy.values()) {
            RewardRouter router = new RewardRouter(new ReferralRegistry(), policy);
            for (int l1 : rates) {
                for (int l2 : rates) {
                    if (l1 + l2 > 10000) {
                        continue;
                    }
                    for (BigInteger base : bases) {
                        for (String principal : principals) {
                            RewardSplit split = router.split(graph, SINK, principal, base, l1, l2);
                            String label = policy + " " + principal + " " + base + " " + l1 + "/" + l2;
                            assertEquals(base, split.getNet().add(split.getL1Reward()).add(split.getL2Reward()), label);
                            assertTrue(split.getNet().signum() >= 0, label);
                            assertEquals(split.totalRewards(), paidOut(split), label);
                        }
                    }
                }
            }
        }
    }

    @Test
    void unregisteredPrincipalSendsBothSharesToTheFallbackSink() {
        RewardRouter router = new RewardRouter(new ReferralRegistry(), RootL2Policy.PAY_ROOT);

        RewardSplit split = router.split(graph, SINK, "stranger", BigInteger.valueOf(10_000), 500, 300);

        assertEquals(BigInteger.valueOf(9_200), split.getNet());
        assertEquals(1, split.getPayouts().size());
        Payout payout = split.getPayouts().get(0);
        assertEquals(SINK, payout.getRecipient());
        assertEquals(BigInteger.valueOf(800), payout.getAmount());
        assertEquals(PayoutKind.FALLBACK, payout.getKind());
    }

    @Test
    void twoLevelChainIsPaidPerLevel() {
        RewardRouter router = new RewardRouter(new ReferralRegistry(), RootL2Policy.PAY_ROOT);

        RewardSplit split = router.split(graph, SINK, "carol", BigInteger.valueOf(10_000), 500, 300);

        assertEquals(List.of(
                new Payout("bob", BigInteger.valueOf(500), PayoutKind.REFERRAL_L1),
                new Payout(ROOT, BigInteger.valueOf(300), PayoutKind.REFERRAL_L2)), split.getPayouts());
    }

    @Test
    void rootAsSecondLevelFollowsThePolicy() {
        RewardSplit payRoot = new RewardRouter(new ReferralRegistry(), RootL2Policy.PAY_ROOT)
                .split(graph, SINK, "bob", BigInteger.valueOf(10_000), 500, 300);
        assertEquals(List.of(
                new Payout(ROOT, BigInteger.valueOf(500), PayoutKind.REFERRAL_L1),
                new Payout(ROOT, BigInteger.valueOf(300), PayoutKind.REFERRAL_L2)), payRoot.getPayouts());

        RewardSplit toSink = new RewardRouter(new ReferralRegistry(), RootL2Policy.FALLBACK_SINK)
                .split(graph, SINK, "bob", BigInteger.valueOf(10_000), 500, 300);
        assertEquals(List.of(
                new Payout(ROOT, BigInteger.valueOf(500), PayoutKind.REFERRAL_L1),
                new Payout(SINK, BigInteger.valueOf(300), PayoutKind.FALLBACK)), toSink.getPayouts());
    }

    @Test
    void zeroSharesProduceNoPayouts() {
        RewardRouter router = new RewardRouter(new ReferralRegistry(), RootL2Policy.PAY_ROOT);

        RewardSplit split = router.split(graph, SINK, "carol", BigInteger.valueOf(19), 500, 0);

        assertTrue(split.getPayouts().isEmpty());
        assertEquals(BigInteger.valueOf(19), split.getNet());
    }

    @Test
    void ratesOutsideBasisPointRangeAreRefused() {
        RewardRouter router = new RewardRouter(new ReferralRegistry(), RootL2Policy.PAY_ROOT);

        assertThrows(IllegalArgumentException.class,
                () -> router.split(graph, SINK, "bob", BigInteger.TEN, -1, 0));
        assertThrows(IllegalArgumentException.class,
                () -> router.split(graph, SINK, "bob", BigInteger.TEN, 0, 10_001));
    }

    private static BigInteger paidOut(RewardSplit split) {
        return split.getPayouts().stream().map(Payout::getAmount).reduce(BigInteger.ZERO, BigInteger::add);
    }

    private static class StubGraph implements ReferralGraph {
        private final Map<String, String> sponsors = new HashMap<>();

        StubGraph edge(String referee, String sponsor) {
            sponsors.put(referee, sponsor);
            return this;
        }

        @Override
        public Optional<String> sponsorOf(String account) {
            return Optional.ofNullable(sponsors.get(account));
        }

        @Override
        public String rootAccount() {
            return ROOT;
        }
    }
}
