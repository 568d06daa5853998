/**
 * Dispatch loop internals. Apart from {@code DispatchLoop.submit} and its
 * volatile reads, everything here runs on the store's dispatch thread.
 */
package com.questrail.statestore.internal.dispatch;
