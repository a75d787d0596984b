/**
 * Request and response bodies of the HTTP API. Field names on the wire are snake_case.
 */
package com.phillippitts.speakerverify.presentation.dto;
