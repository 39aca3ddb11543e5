package com.callprobe.runtime;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJO written to perf_report.json by ShutdownHook.
 */
public class PerfReport {

    @SerializedName("units")
    public List<String> units;

    @SerializedName("calls")
    public List<CallStats> calls;

    @SerializedName("loops")
    public List<LoopStats> loops;

    public static class CallStats {
        @SerializedName("name")        public String name;
        @SerializedName("call_count")  public long callCount;
        @SerializedName("timed_count") public long timedCount;
        @SerializedName("total_nanos") public long totalNanos;
        @SerializedName("max_nanos")   public long maxNanos;
    }

    public static class LoopStats {
        @SerializedName("loop_id")    public String loopId;
        @SerializedName("iterations") public long iterations;
    }
}
