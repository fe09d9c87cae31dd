package com.ivamare.connect.log;

import com.ivamare.connect.model.MessageDirection;
import com.ivamare.connect.model.MessageStatus;

/**
 * Number of log entries with a direction and status.
 */
public record StatusCount(MessageDirection direction, MessageStatus status, long count) {}
