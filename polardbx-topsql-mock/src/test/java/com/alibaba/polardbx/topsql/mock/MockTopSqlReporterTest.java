/*
 * Copyright [2013-2021], Alibaba Group Holding Limited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.polardbx.topsql.mock;

import com.alibaba.polardbx.topsql.common.digest.DefaultSqlDigester;
import com.alibaba.polardbx.topsql.common.digest.Digest;
import com.alibaba.polardbx.topsql.common.digest.SqlDigester;
import com.alibaba.polardbx.topsql.common.exception.TddlRuntimeException;
import com.alibaba.polardbx.topsql.common.exception.code.ErrorCode;
import com.alibaba.polardbx.topsql.common.model.TopSqlCpuTimeRecord;
import com.alibaba.polardbx.topsql.common.properties.TopSqlMockConfig;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.Collections;
import java.util.List;

public class MockTopSqlReporterTest {

    private static final String SQL = "SELECT 1";

    private static final Digest PLAN_DIGEST = Digest.fromHex("0a0b0c");

    private static final Digest OTHER_PLAN_DIGEST = Digest.fromHex("0d0e0f");

    private MockTopSqlReporter reporter;

    private Digest sqlDigest;

    @Before
    public void before() {
        reporter = new MockTopSqlReporter(DefaultSqlDigester.getInstance(), new TopSqlMockConfig(500, 10));
        sqlDigest = reporter.genSqlDigest(SQL);
    }

    @Test
    public void testRegisterSqlFirstWins() {
        reporter.registerSql(sqlDigest, "select ?");
        reporter.registerSql(sqlDigest, "select ? from dual");
        Assert.assertEquals("select ?", reporter.getSql(sqlDigest));
        Assert.assertEquals("", reporter.getSql(Digest.fromHex("ff")));
    }

    @Test
    public void testRegisterPlanFirstWins() {
        reporter.registerPlan(PLAN_DIGEST, "TableReader");
        reporter.registerPlan(PLAN_DIGEST, "IndexReader");
        Assert.assertEquals("TableReader", reporter.getPlan(PLAN_DIGEST));
        Assert.assertEquals("", reporter.getPlan(OTHER_PLAN_DIGEST));
        // the two registries are independent
        Assert.assertEquals("", reporter.getSql(PLAN_DIGEST));
    }

    @Test
    public void testAccumulate() {
        reporter.registerSql(sqlDigest, "select ?");
        reporter.collect(1L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5)));
        reporter.collect(2L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 7)));

        List<TopSqlCpuTimeRecord> stats = reporter.getSqlStatsBySql(SQL, false);
        Assert.assertEquals(1, stats.size());
        Assert.assertEquals(12, stats.get(0).getCpuTimeMs());
        Assert.assertEquals(sqlDigest, stats.get(0).getSqlDigest());
        Assert.assertEquals(PLAN_DIGEST, stats.get(0).getPlanDigest());
    }

    @Test
    public void testAccumulateInOneBatch() {
        reporter.collect(1L, ImmutableList.of(
            new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 1),
            new TopSqlCpuTimeRecord(sqlDigest, OTHER_PLAN_DIGEST, 2),
            new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 3),
            new TopSqlCpuTimeRecord(reporter.genSqlDigest("select 2 from t"), PLAN_DIGEST, 100)));

        List<TopSqlCpuTimeRecord> stats = reporter.getSqlStatsBySql("select 42", false);
        Assert.assertEquals(2, stats.size());
        long samePlan = 0;
        long otherPlan = 0;
        for (TopSqlCpuTimeRecord stat : stats) {
            if (PLAN_DIGEST.equals(stat.getPlanDigest())) {
                samePlan = stat.getCpuTimeMs();
            } else {
                otherPlan = stat.getCpuTimeMs();
            }
        }
        Assert.assertEquals(4, samePlan);
        Assert.assertEquals(2, otherPlan);
        Assert.assertEquals(3, reporter.getAllSqlStats().size());
    }

    @Test
    public void testConcatenatedDigestsDoNotCollide() {
        Digest sqlA = Digest.fromHex("0102");
        Digest planA = Digest.fromHex("03");
        Digest sqlB = Digest.fromHex("01");
        Digest planB = Digest.fromHex("0203");
        reporter.collect(1L, ImmutableList.of(
            new TopSqlCpuTimeRecord(sqlA, planA, 1),
            new TopSqlCpuTimeRecord(sqlB, planB, 1)));
        Assert.assertEquals(2, reporter.getAllSqlStats().size());
    }

    @Test
    public void testCollectCntCountsEmptyBatches() {
        long before = reporter.getCollectCnt();
        reporter.collect(1L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5)));
        reporter.collect(2L, Collections.emptyList());
        reporter.collect(3L, null);
        reporter.collect(4L, Lists.newArrayList(
            new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 1),
            new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 1)));
        Assert.assertEquals(before + 4, reporter.getCollectCnt());
        Assert.assertEquals(1, reporter.getAllSqlStats().size());
    }

    @Test
    public void testInvalidRecordStillCounted() {
        List<TopSqlCpuTimeRecord> batch = Lists.newArrayList(
            new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5),
            new TopSqlCpuTimeRecord(sqlDigest, null, 5));
        try {
            reporter.collect(1L, batch);
            Assert.fail();
        } catch (TddlRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_ASSERT_NULL, e.getErrorCodeType());
        }
        Assert.assertEquals(1, reporter.getCollectCnt());
        Assert.assertTrue(reporter.getAllSqlStats().isEmpty());
    }

    @Test
    public void testPlanMustBeResolved() {
        reporter.collect(1L, ImmutableList.of(
            new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5),
            new TopSqlCpuTimeRecord(sqlDigest, OTHER_PLAN_DIGEST, 6)));
        reporter.registerPlan(OTHER_PLAN_DIGEST, "TableReader");

        List<TopSqlCpuTimeRecord> resolved = reporter.getSqlStatsBySql(SQL, true);
        Assert.assertEquals(1, resolved.size());
        Assert.assertEquals(OTHER_PLAN_DIGEST, resolved.get(0).getPlanDigest());
        Assert.assertEquals(2, reporter.getSqlStatsBySql(SQL, false).size());

        reporter.registerPlan(PLAN_DIGEST, "IndexLookUp");
        Assert.assertEquals(2, reporter.getSqlStatsBySql(SQL, true).size());
    }

    @Test
    public void testEmptyPlanTextIsUnresolved() {
        reporter.registerPlan(PLAN_DIGEST, "");
        reporter.collect(1L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5)));
        Assert.assertTrue(reporter.getSqlStatsBySql(SQL, true).isEmpty());
        Assert.assertEquals(1, reporter.getSqlStatsBySql(SQL, false).size());
    }

    @Test
    public void testNoMatch() {
        Assert.assertTrue(reporter.getSqlStatsBySql(SQL, false).isEmpty());
        StatsLookup lookup = reporter.findSqlStatsBySql(SQL, false);
        Assert.assertEquals(LookupOutcome.EMPTY, lookup.getOutcome());
        Assert.assertTrue(lookup.getRecords().isEmpty());
    }

    @Test
    public void testReturnedRecordsAreSnapshots() {
        reporter.collect(1L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5)));
        TopSqlCpuTimeRecord snapshot = reporter.getSqlStatsBySql(SQL, false).get(0);
        snapshot.setCpuTimeMs(1000);
        reporter.collect(2L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5)));
        Assert.assertEquals(10, reporter.getSqlStatsBySql(SQL, false).get(0).getCpuTimeMs());
        Assert.assertEquals(1000, snapshot.getCpuTimeMs());
    }

    @Test
    public void testIncomingSampleNotAliased() {
        TopSqlCpuTimeRecord sample = new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5);
        reporter.collect(1L, ImmutableList.of(sample));
        reporter.collect(2L, ImmutableList.of(sample));
        Assert.assertEquals(5, sample.getCpuTimeMs());
        Assert.assertEquals(10, reporter.getAllSqlStats().get(0).getCpuTimeMs());
    }

    @Test
    public void testWaitCollectCntTimeout() {
        long start = System.currentTimeMillis();
        Assert.assertFalse(reporter.waitCollectCnt(1));
        long elapsed = System.currentTimeMillis() - start;
        Assert.assertTrue("elapsed " + elapsed, elapsed >= 450);
        Assert.assertTrue("elapsed " + elapsed, elapsed < 5000);
    }

    @Test
    public void testWaitCollectCntHugeCountNeverReached() {
        reporter.collect(1L, Collections.emptyList());
        long before = reporter.getCollectCnt();
        Assert.assertFalse(reporter.waitCollectCnt(Long.MAX_VALUE));
        Assert.assertEquals(before, reporter.getCollectCnt());
    }

    @Test
    public void testWaitCollectCntAlreadyReached() {
        Assert.assertTrue(reporter.waitCollectCnt(0));
        Assert.assertTrue(reporter.waitCollectCnt(-1));
    }

    @Test
    public void testLookupTimeout() {
        reporter.collect(1L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5)));
        StatsLookup lookup = reporter.lookupSqlStatsBySql(SQL, true);
        Assert.assertEquals(LookupOutcome.TIMED_OUT, lookup.getOutcome());
        Assert.assertFalse(lookup.isFound());
        Assert.assertTrue(lookup.getRecords().isEmpty());
        Assert.assertTrue(reporter.getSqlStatsBySqlWithRetry(SQL, true).isEmpty());
    }

    @Test
    public void testLookupFoundWithoutWaiting() {
        reporter.collect(1L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 5)));
        long before = reporter.getCollectCnt();
        StatsLookup lookup = reporter.lookupSqlStatsBySql(SQL, false);
        Assert.assertEquals(LookupOutcome.FOUND, lookup.getOutcome());
        Assert.assertEquals(5, lookup.getRecords().get(0).getCpuTimeMs());
        Assert.assertEquals(before, reporter.getCollectCnt());
    }

    @Test
    public void testOnlyDigestOfSqlIsUsed() {
        SqlDigester digester = Mockito.mock(SqlDigester.class);
        Mockito.when(digester.sqlDigest("select a")).thenReturn(sqlDigest);
        MockTopSqlReporter mockReporter = new MockTopSqlReporter(digester, new TopSqlMockConfig(100, 10));

        mockReporter.collect(1L, ImmutableList.of(new TopSqlCpuTimeRecord(sqlDigest, PLAN_DIGEST, 3)));
        mockReporter.registerPlan(PLAN_DIGEST, "TableReader");
        Assert.assertEquals(1, mockReporter.getSqlStatsBySql("select a", true).size());

        Mockito.verify(digester).sqlDigest("select a");
        Mockito.verify(digester, Mockito.never()).normalizePlan(Mockito.anyString());
    }

    @Test
    public void testRejectNullRegistration() {
        try {
            reporter.registerSql(null, "select ?");
            Assert.fail();
        } catch (TddlRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_ASSERT_NULL, e.getErrorCodeType());
        }
        try {
            reporter.registerPlan(PLAN_DIGEST, null);
            Assert.fail();
        } catch (TddlRuntimeException e) {
            Assert.assertEquals(ErrorCode.ERR_ASSERT_NULL, e.getErrorCodeType());
        }
    }

    @Test
    public void testDefaultConfig() {
        MockTopSqlReporter defaultReporter = new MockTopSqlReporter();
        Assert.assertEquals(10000L, defaultReporter.getConfig().getWaitTimeoutMs());
        Assert.assertEquals(10L, defaultReporter.getConfig().getPollIntervalMs());
        Assert.assertEquals(DefaultSqlDigester.getInstance().sqlDigest(SQL), defaultReporter.genSqlDigest(SQL));
    }
}
