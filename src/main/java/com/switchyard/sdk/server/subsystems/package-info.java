/**
 * Interfaces for implementation of Switchyard SDK components.
 * <p>
 * Most applications will not need to refer to these types. You will use them if you are creating a
 * plugin component, such as a data adapter or a persistent storage for sticky values.
 */
package com.switchyard.sdk.server.subsystems;
