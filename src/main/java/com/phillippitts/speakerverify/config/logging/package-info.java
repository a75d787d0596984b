/**
 * Request correlation for Log4j2: a servlet filter populating the ThreadContext.
 */
package com.phillippitts.speakerverify.config.logging;
