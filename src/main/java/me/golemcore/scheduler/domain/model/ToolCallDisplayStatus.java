package me.golemcore.scheduler.domain.model;

/**
 * Coarse status shown by display layers.
 */
public enum ToolCallDisplayStatus {
    PENDING, EXECUTING, CONFIRMING, SUCCESS, ERROR, CANCELED
}
