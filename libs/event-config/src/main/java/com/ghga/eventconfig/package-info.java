/**
 * Topic and event-type configuration shared by the file-management and access-control services.
 *
 * <p>Each record binds a pair of properties under {@code ghga.events}. A service enables only the
 * records it needs, so unrelated properties never have to be set:
 *
 * <pre>{@code
 * @Configuration
 * @EnableConfigurationProperties({
 *     FileUploadReceivedEventsConfig.class,
 *     NotificationEventsConfig.class
 * })
 * class EventConfiguration {}
 * }</pre>
 *
 * All values are required; a missing or blank one fails application startup.
 */
package com.ghga.eventconfig;
