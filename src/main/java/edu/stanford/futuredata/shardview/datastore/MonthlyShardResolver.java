package edu.stanford.futuredata.shardview.datastore;

import edu.stanford.futuredata.shardview.interfaces.ShardResolver;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * One shard per account and calendar month (UTC): {@code account/<id>-YYYYMM}.
 */
public class MonthlyShardResolver implements ShardResolver {

    @Override
    public List<String> shardsForRange(String accountId, long startTime, long endTime) {
        List<String> shards = new ArrayList<>();
        if (endTime < startTime) {
            return shards;
        }
        YearMonth month = monthOf(startTime);
        YearMonth last = monthOf(endTime);
        while (!month.isAfter(last)) {
            shards.add(shardName(accountId, month));
            month = month.plusMonths(1);
        }
        return shards;
    }

    public static String shardName(String accountId, YearMonth month) {
        return String.format("account/%s-%04d%02d", accountId, month.getYear(), month.getMonthValue());
    }

    private static YearMonth monthOf(long epochSeconds) {
        return YearMonth.from(Instant.ofEpochSecond(epochSeconds).atZone(ZoneOffset.UTC));
    }
}
