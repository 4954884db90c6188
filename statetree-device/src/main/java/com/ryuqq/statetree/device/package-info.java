/**
 * Device (WDM) state model built on the state tree.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statetree.device.Device} - Device node, registration attributes and services</li>
 *   <li>{@link com.ryuqq.statetree.device.Features} - Feature collections by category</li>
 *   <li>{@link com.ryuqq.statetree.device.Feature} - Typed view of one feature record</li>
 *   <li>{@link com.ryuqq.statetree.device.DeviceRegistrationHandler} - JSON registration responses (Jackson)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateTree Team
 */
package com.ryuqq.statetree.device;
