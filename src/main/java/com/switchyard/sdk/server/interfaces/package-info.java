/**
 * Types that are part of the public API of {@link com.switchyard.sdk.server.SwitchyardClient}:
 * evaluation results, per-call options, events and callbacks.
 */
package com.switchyard.sdk.server.interfaces;
