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
import com.alibaba.polardbx.topsql.common.model.TopSqlCpuTimeRecord;
import com.alibaba.polardbx.topsql.common.properties.TopSqlMockConfig;
import com.alibaba.polardbx.topsql.common.reporter.TopSqlReporter;
import com.alibaba.polardbx.topsql.common.utils.Assert;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.math.LongMath;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory top sql reporter for tests.
 * <p>
 * Producers register sql/plan texts and push cpu time samples, the samples are summed up per
 * (sql digest, plan digest). Tests query the summed records and use {@link #waitCollectCnt(long)}
 * or {@link #getSqlStatsBySqlWithRetry(String, boolean)} to wait for an asynchronous producer.
 * <p>
 * Registries and stats share one lock. The collect counter is read without it, so a waiting
 * thread never competes with producers for that lock.
 */
public class MockTopSqlReporter implements TopSqlReporter {

    private static final Logger logger = LoggerFactory.getLogger(MockTopSqlReporter.class);

    private final Lock lock = new ReentrantLock();

    /**
     * sql digest -> normalized sql
     */
    private final Map<Digest, String> sqlMap = Maps.newHashMap();

    /**
     * plan digest -> normalized plan
     */
    private final Map<Digest, String> planMap = Maps.newHashMap();

    /**
     * (sql digest, plan digest) -> sql stats
     */
    private final Map<Pair<Digest, Digest>, TopSqlCpuTimeRecord> sqlStatsMap = Maps.newHashMap();

    /**
     * number of collect calls, including the ones with an empty batch
     */
    private final AtomicLong collectCnt = new AtomicLong();

    private final Lock progressLock = new ReentrantLock();

    private final Condition progressCondition = progressLock.newCondition();

    private final SqlDigester sqlDigester;

    private final TopSqlMockConfig config;

    public MockTopSqlReporter() {
        this(DefaultSqlDigester.getInstance(), TopSqlMockConfig.fromClasspath(TopSqlMockConfig.DEFAULT_RESOURCE));
    }

    public MockTopSqlReporter(SqlDigester sqlDigester, TopSqlMockConfig config) {
        Assert.assertNotNull(sqlDigester, "sqlDigester");
        Assert.assertNotNull(config, "config");
        this.sqlDigester = sqlDigester;
        this.config = config;
    }

    @Override
    public void collect(long timestamp, List<TopSqlCpuTimeRecord> records) {
        try {
            if (records == null || records.isEmpty()) {
                return;
            }
            for (TopSqlCpuTimeRecord record : records) {
                Assert.assertNotNull(record, "cpu time record");
                Assert.assertNotNull(record.getSqlDigest(), "sql digest");
                Assert.assertNotNull(record.getPlanDigest(), "plan digest");
            }
            lock.lock();
            try {
                for (TopSqlCpuTimeRecord record : records) {
                    Pair<Digest, Digest> key = ImmutablePair.of(record.getSqlDigest(), record.getPlanDigest());
                    TopSqlCpuTimeRecord stats = sqlStatsMap.get(key);
                    if (stats == null) {
                        stats = new TopSqlCpuTimeRecord(record.getSqlDigest(), record.getPlanDigest(), 0);
                        sqlStatsMap.put(key, stats);
                    }
                    stats.setCpuTimeMs(stats.getCpuTimeMs() + record.getCpuTimeMs());
                }
            } finally {
                lock.unlock();
            }
            if (logger.isDebugEnabled()) {
                logger.debug("collected " + records.size() + " cpu time records at " + timestamp);
            }
        } finally {
            collectCnt.incrementAndGet();
            signalProgress();
        }
    }

    @Override
    public void registerSql(Digest sqlDigest, String normalizedSql) {
        Assert.assertNotNull(sqlDigest, "sql digest");
        Assert.assertNotNull(normalizedSql, "normalized sql");
        lock.lock();
        try {
            sqlMap.putIfAbsent(sqlDigest, normalizedSql);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void registerPlan(Digest planDigest, String normalizedPlan) {
        Assert.assertNotNull(planDigest, "plan digest");
        Assert.assertNotNull(normalizedPlan, "normalized plan");
        lock.lock();
        try {
            planMap.putIfAbsent(planDigest, normalizedPlan);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return registered normalized sql, or empty string if the digest is unknown
     */
    public String getSql(Digest sqlDigest) {
        lock.lock();
        try {
            return StringUtils.defaultString(sqlMap.get(sqlDigest));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return registered normalized plan, or empty string if the digest is unknown
     */
    public String getPlan(Digest planDigest) {
        lock.lock();
        try {
            return StringUtils.defaultString(planMap.get(planDigest));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stat records of the given sql, in no particular order. The returned records are copies.
     *
     * @param planMustBeResolved only keep records whose plan digest has a registered plan
     */
    public List<TopSqlCpuTimeRecord> getSqlStatsBySql(String sql, boolean planMustBeResolved) {
        final Digest sqlDigest = genSqlDigest(sql);
        List<TopSqlCpuTimeRecord> stats = Lists.newArrayListWithCapacity(2);
        lock.lock();
        try {
            for (TopSqlCpuTimeRecord stmt : sqlStatsMap.values()) {
                if (sqlDigest.equals(stmt.getSqlDigest())) {
                    stats.add(stmt.copy());
                }
            }
        } finally {
            lock.unlock();
        }
        if (!planMustBeResolved || stats.isEmpty()) {
            return stats;
        }
        // plans registered after the scan above are visible here
        List<TopSqlCpuTimeRecord> resolved = Lists.newArrayListWithCapacity(stats.size());
        lock.lock();
        try {
            for (TopSqlCpuTimeRecord stmt : stats) {
                if (StringUtils.isNotEmpty(planMap.get(stmt.getPlanDigest()))) {
                    resolved.add(stmt);
                }
            }
        } finally {
            lock.unlock();
        }
        return resolved;
    }

    /**
     * Same as {@link #getSqlStatsBySql(String, boolean)} with an explicit outcome, never blocks.
     */
    public StatsLookup findSqlStatsBySql(String sql, boolean planMustBeResolved) {
        return StatsLookup.of(getSqlStatsBySql(sql, planMustBeResolved), LookupOutcome.EMPTY);
    }

    /**
     * Query until some record matches or the wait timeout elapses.
     *
     * @return matching records, empty if the deadline was reached first
     */
    public List<TopSqlCpuTimeRecord> getSqlStatsBySqlWithRetry(String sql, boolean planMustBeResolved) {
        return lookupSqlStatsBySql(sql, planMustBeResolved).getRecords();
    }

    /**
     * Query until some record matches or the wait timeout elapses. The outcome tells a timeout
     * apart from a successful lookup.
     * <p>
     * The query is repeated after every collect call and at least once per poll interval, so a
     * plan registered after the last collect is still picked up before the deadline.
     */
    public StatsLookup lookupSqlStatsBySql(String sql, boolean planMustBeResolved) {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getWaitTimeoutMs());
        final long pollIntervalNanos = TimeUnit.MILLISECONDS.toNanos(config.getPollIntervalMs());
        while (true) {
            long seen = collectCnt.get();
            List<TopSqlCpuTimeRecord> stats = getSqlStatsBySql(sql, planMustBeResolved);
            if (!stats.isEmpty()) {
                return StatsLookup.of(stats, LookupOutcome.FOUND);
            }
            long now = System.nanoTime();
            if (now - deadline >= 0 || Thread.currentThread().isInterrupted()) {
                logger.warn("no stats of sql " + sql + " after " + config.getWaitTimeoutMs() + "ms");
                return StatsLookup.of(stats, LookupOutcome.TIMED_OUT);
            }
            long tick = now + pollIntervalNanos;
            awaitCollectCnt(seen + 1, tick - deadline > 0 ? deadline : tick);
        }
    }

    /**
     * Block until {@code count} more collect calls have finished since this call started, or
     * the wait timeout elapses. Empty batches count as well.
     *
     * @return false if the deadline was reached or the thread was interrupted
     */
    public boolean waitCollectCnt(long count) {
        final long end = LongMath.saturatedAdd(collectCnt.get(), count);
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(config.getWaitTimeoutMs());
        boolean reached = awaitCollectCnt(end, deadline);
        if (!reached) {
            logger.warn("collect count did not reach " + end + " in " + config.getWaitTimeoutMs()
                + "ms, current " + collectCnt.get());
        }
        return reached;
    }

    private boolean awaitCollectCnt(long end, long deadline) {
        if (collectCnt.get() >= end) {
            return true;
        }
        final long pollIntervalNanos = TimeUnit.MILLISECONDS.toNanos(config.getPollIntervalMs());
        progressLock.lock();
        try {
            while (collectCnt.get() < end) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                progressCondition.await(Math.min(remaining, pollIntervalNanos), TimeUnit.NANOSECONDS);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("interrupted while waiting for collect count " + end);
            return false;
        } finally {
            progressLock.unlock();
        }
    }

    private void signalProgress() {
        progressLock.lock();
        try {
            progressCondition.signalAll();
        } finally {
            progressLock.unlock();
        }
    }

    public long getCollectCnt() {
        return collectCnt.get();
    }

    /**
     * copies of all stat records, in no particular order
     */
    public List<TopSqlCpuTimeRecord> getAllSqlStats() {
        lock.lock();
        try {
            List<TopSqlCpuTimeRecord> stats = Lists.newArrayListWithCapacity(sqlStatsMap.size());
            for (TopSqlCpuTimeRecord stmt : sqlStatsMap.values()) {
                stats.add(stmt.copy());
            }
            return stats;
        } finally {
            lock.unlock();
        }
    }

    public Digest genSqlDigest(String sql) {
        return sqlDigester.sqlDigest(sql);
    }

    public TopSqlMockConfig getConfig() {
        return config;
    }
}
