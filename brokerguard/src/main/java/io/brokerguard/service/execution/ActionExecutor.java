package io.brokerguard.service.execution;

import io.brokerguard.domain.approval.ActionDescriptor;
import io.brokerguard.service.token.AccessToken;

/**
 * The actual brokerage call behind a mutating tool (order placement, cancellation, ...).
 *
 * @param <T> result of the brokerage call
 */
@FunctionalInterface
public interface ActionExecutor<T> {

    T execute(ActionDescriptor action, AccessToken token) throws Exception;
}
