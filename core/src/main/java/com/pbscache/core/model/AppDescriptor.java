package com.pbscache.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Application registry entry: resource defaults and installed versions of one HPC application.
 * <p>
 * Field names are capitalised on the wire to stay compatible with existing registry consumers.
 * </p>
 */
@Data
@NoArgsConstructor
public class AppDescriptor {

    @JsonProperty("Name")
    private String name;

    @JsonProperty("DefaultMinCores")
    private int defaultMinCores = 0;

    @JsonProperty("MaxCores")
    private int maxCores = 0;

    @JsonProperty("DefaultVersion")
    private String defaultVersion;

    @JsonProperty("Versions")
    private List<String> versions = new ArrayList<>();

    /**
     * Whether the application runs under MPI; {@code null} when unspecified.
     */
    @JsonProperty("MPI")
    private Boolean mpi;

    @JsonProperty("OpenMP")
    private int openMp = 0;

    @JsonProperty("MaxGPU")
    private int maxGpu = 0;

    @JsonProperty("DefaultGPU")
    private int defaultGpu = 0;

    /**
     * Default core count when GPUs are requested; {@code -1} means "derive from DefaultMinCores".
     */
    @JsonProperty("DefaultCoreWithGPU")
    private int defaultCoreWithGpu = -1;
}
