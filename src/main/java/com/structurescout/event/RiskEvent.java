package com.structurescout.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the RiskGate, RiskLedger or TradingHaltService detects a risk condition.
 *
 * <p>Risk events carry the type of risk condition, its severity level, a human-readable
 * message, and a details map for condition-specific data (e.g., current daily P&L fraction,
 * configured limit, open position count).
 *
 * <p>Key listeners:
 * <ul>
 *   <li>RiskGate -- halts trading on WEEKLY_LOSS_LIMIT_BREACH when configured</li>
 *   <li>CustomMetricsService -- counts breaches</li>
 *   <li>the notification collaborator, outside this engine</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, null);
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>DAILY_LOSS_LIMIT_BREACH: {"dailyPnl": -0.036, "limit": 0.03}</li>
     *   <li>MAX_POSITIONS_REACHED: {"openPositions": 3, "limit": 3}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
