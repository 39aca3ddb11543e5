package com.callprobe.instrumenter.report;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * Gson model of instrumentation_manifest.json.
 */
public class SiteManifest {

    @SerializedName("runtime_class")
    public String runtimeClass;

    @SerializedName("source_root")
    public String sourceRoot;

    public Totals totals;

    public List<Site> sites;

    public static class Totals {
        public int files;
        public long calls;
        public long loops;
        public long units;
        public long methods;
    }

    public static class Site {
        public String file;
        public String kind;    // call | loop | unit | method
        public String name;    // resolved call name, loop id, unit name or method label
        public int line;
    }
}
