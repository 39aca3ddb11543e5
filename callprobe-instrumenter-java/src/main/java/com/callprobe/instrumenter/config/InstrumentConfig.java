package com.callprobe.instrumenter.config;

import com.callprobe.instrumenter.engine.RuntimeApi;
import com.callprobe.instrumenter.engine.Sha256SourceHasher;
import com.google.gson.annotations.SerializedName;

import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of instrument.json. Every field is optional.
 */
public class InstrumentConfig {

    /** Names added to the built-in exclusion list. */
    @SerializedName("excluded_names")
    private List<String> excludedNames;

    /** Fully qualified telemetry class the generated code calls (default: com.callprobe.runtime.PerfRuntime). */
    @SerializedName("runtime_class")
    private String runtimeClass;

    /** Hex characters kept from the SHA-256 digest (default: 8). */
    @SerializedName("hash_length")
    private Integer hashLength;

    /** One identity tracker for the whole run rather than one per file (default: true). */
    @SerializedName("share_identity_tracker")
    private Boolean shareIdentityTracker;

    @SerializedName("verbose")
    private Boolean verbose;

    /** Trace entry to and exit from every method and constructor body (default: false). */
    @SerializedName("trace_methods")
    private Boolean traceMethods;

    public static InstrumentConfig defaults() {
        return new InstrumentConfig();
    }

    public List<String> getExcludedNames() { return excludedNames != null ? excludedNames : Collections.emptyList(); }
    public String getRuntimeClass()        { return runtimeClass != null ? runtimeClass : RuntimeApi.DEFAULT_CLASS; }
    public int getHashLength()             { return hashLength != null ? hashLength : Sha256SourceHasher.DEFAULT_LENGTH; }
    public boolean isShareIdentityTracker() { return shareIdentityTracker == null || shareIdentityTracker; }
    public boolean isVerbose()             { return verbose != null && verbose; }
    public boolean isTraceMethods()        { return traceMethods != null && traceMethods; }
}
