package com.componentwatch.monitor.model;

import java.util.List;

public record AlertPage(
    long total,
    int page,
    int limit,
    int pages,
    List<AlertRecord> alerts
) {
    public static int pageCount(long total, int limit) {
        if (limit <= 0 || total <= 0) {
            return 1;
        }
        return (int) Math.max(1, (total + limit - 1) / limit);
    }
}
