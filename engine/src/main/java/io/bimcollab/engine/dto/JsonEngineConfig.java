package io.bimcollab.engine.dto;

/**
 * JSON shape of an engine config file. Every field is optional; missing
 * fields fall back to the defaults of EngineConfig.
 * Example:
 *   {
 *     "conflictWindowSeconds": 300,
 *     "versionEvery": 10,
 *     "detectAcrossVersions": false,
 *     "workerThreadName": "change-processor"
 *   }
 */
public class JsonEngineConfig {
    public Long conflictWindowSeconds;
    public Integer versionEvery;
    public Boolean detectAcrossVersions;
    public String workerThreadName;
}
