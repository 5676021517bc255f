package me.christianrobert.spmodernize.journal;

import java.util.EnumMap;
import java.util.Map;

public class JournalStatistics {

    private final int totalRecords;
    private final Map<BackupStatus, Integer> countByStatus;

    public JournalStatistics(Map<BackupStatus, Integer> countByStatus) {
        this.countByStatus = new EnumMap<>(BackupStatus.class);
        for (BackupStatus status : BackupStatus.values()) {
            this.countByStatus.put(status, countByStatus.getOrDefault(status, 0));
        }
        this.totalRecords = this.countByStatus.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public int getCount(BackupStatus status) {
        return countByStatus.get(status);
    }

    public Map<BackupStatus, Integer> getCountByStatus() {
        return new EnumMap<>(countByStatus);
    }

    @Override
    public String toString() {
        return "JournalStatistics{total=" + totalRecords + ", byStatus=" + countByStatus + "}";
    }
}
