package com.bizflow.process.core.engine.runtime;

import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import com.bizflow.process.integration.enumerations.BizFlowSideEffectType;

/**
 * A requested status change of an instance, produced by an {@link IStatusChangeRule}.
 *
 * @param newStatus  status to move to
 * @param reason     recorded in history, and as suspension or end reason where it applies
 * @param effectType side effect to emit once committed
 */
public record StatusChange(BizFlowProcessStatus newStatus, String reason, BizFlowSideEffectType effectType) {
}
