package com.structurescout.domain.enums;

/**
 * Direction of a proposed trade.
 */
public enum TradeDirection {
    LONG,
    SHORT
}
