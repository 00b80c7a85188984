/**
 * Shared HTTP plumbing used by the SDK's network components. For internal use only.
 */
package com.switchyard.sdk.internal.http;
