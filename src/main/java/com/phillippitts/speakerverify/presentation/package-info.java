/**
 * HTTP boundary of the service: controllers, request/response records and error translation.
 *
 * <p>Nothing in this layer holds state; controllers delegate to
 * {@link com.phillippitts.speakerverify.service.verification.SpeakerVerificationService} and the
 * model coordinator.
 */
package com.phillippitts.speakerverify.presentation;
