package com.mesosphere.secretsmanager.backend.vault;

import org.junit.Assert;
import org.junit.Test;

import java.util.Optional;

public class RenewalPolicyTest {

    @Test
    public void testFailedLookupRelogs() {
        Assert.assertEquals(RenewalAction.RELOGIN, RenewalPolicy.decide(Optional.empty(), 300));
    }

    @Test
    public void testLongLivedTokenIsLeftAlone() {
        Assert.assertEquals(RenewalAction.NONE, decide(300, true));
        Assert.assertEquals(RenewalAction.NONE, decide(3600, false));
    }

    @Test
    public void testShortLivedTokenIsRenewed() {
        Assert.assertEquals(RenewalAction.RENEW, decide(299, true));
        Assert.assertEquals(RenewalAction.RENEW, decide(0, true));
    }

    @Test
    public void testShortLivedNonRenewableTokenIsReported() {
        Assert.assertEquals(RenewalAction.REPORT_NOT_RENEWABLE, decide(10, false));
    }

    private static RenewalAction decide(long ttl, boolean renewable) {
        return RenewalPolicy.decide(Optional.of(new TokenInfo(ttl, renewable)), 300);
    }
}
