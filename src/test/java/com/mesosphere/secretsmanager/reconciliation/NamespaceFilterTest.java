package com.mesosphere.secretsmanager.reconciliation;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class NamespaceFilterTest {

    @Test
    public void testAll() {
        Assert.assertTrue(NamespaceFilter.all().isWatched("anything"));
        Assert.assertFalse(NamespaceFilter.all().isExcluded("anything"));
    }

    @Test
    public void testWatchAndExclude() {
        NamespaceFilter filter = NamespaceFilter.of(Arrays.asList("a", "b"), Collections.singletonList("b"));
        Assert.assertTrue(filter.isWatched("a"));
        Assert.assertTrue(filter.isWatched("b"));
        Assert.assertFalse(filter.isWatched("c"));
        Assert.assertTrue(filter.isExcluded("b"));
        Assert.assertFalse(filter.isExcluded("a"));
    }
}
