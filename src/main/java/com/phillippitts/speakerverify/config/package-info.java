/**
 * Spring configuration: executors, HTTP client, request logging context and bound properties.
 *
 * <p>Configuration properties live in {@code config.properties} and are registered by
 * {@link com.phillippitts.speakerverify.SpeakerVerifyApplication}.
 *
 * @since 1.0
 */
package com.phillippitts.speakerverify.config;
