/**
 * This package contains configuration builders for the SDK's standard components.
 * <p>
 * The builders are obtained from {@link com.switchyard.sdk.server.Components}.
 */
package com.switchyard.sdk.server.integrations;
