package com.phillippitts.speakerverify.presentation.controller;

import com.phillippitts.speakerverify.domain.AudioSource;
import com.phillippitts.speakerverify.domain.BatchItemResult;
import com.phillippitts.speakerverify.domain.Embedding;
import com.phillippitts.speakerverify.domain.VerificationResult;
import com.phillippitts.speakerverify.exception.InvalidRequestException;
import com.phillippitts.speakerverify.presentation.dto.BatchVerifyRequest;
import com.phillippitts.speakerverify.presentation.dto.BatchVerifyResponse;
import com.phillippitts.speakerverify.presentation.dto.CompareEmbeddingsRequest;
import com.phillippitts.speakerverify.presentation.dto.CompareEmbeddingsResponse;
import com.phillippitts.speakerverify.presentation.dto.EmbeddingResponse;
import com.phillippitts.speakerverify.presentation.dto.ExtractEmbeddingRequest;
import com.phillippitts.speakerverify.presentation.dto.VerifyRequest;
import com.phillippitts.speakerverify.presentation.dto.VerifyResponse;
import com.phillippitts.speakerverify.service.verification.SpeakerVerificationService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Verification and embedding endpoints.
 *
 * <p>Audio can be uploaded as multipart parts or referenced from a JSON body by URL
 * ({@code *_url}) or server path ({@code *_path}).
 */
@RestController
class VerificationController {

    private final SpeakerVerificationService service;

    VerificationController(SpeakerVerificationService service) {
        this.service = service;
    }

    @PostMapping(value = "/verify", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<VerifyResponse> verifyUpload(@RequestPart("audio1") MultipartFile audio1,
                                                @RequestPart("audio2") MultipartFile audio2,
                                                @RequestParam(value = "threshold", required = false) Double threshold) {
        VerificationResult result = service.verify(upload(audio1), upload(audio2), threshold);
        return ResponseEntity.ok(VerifyResponse.from(result));
    }

    @PostMapping(value = "/verify", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<VerifyResponse> verifyJson(@RequestBody VerifyRequest request) {
        AudioSource first = urlOrPath(request.audio1Url(), request.audio1Path(), "audio1");
        AudioSource second = urlOrPath(request.audio2Url(), request.audio2Path(), "audio2");
        VerificationResult result = service.verify(first, second, request.threshold());
        return ResponseEntity.ok(VerifyResponse.from(result));
    }

    @PostMapping(value = "/verify_batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<BatchVerifyResponse> verifyBatch(@RequestBody BatchVerifyRequest request) {
        if (request.reference() == null || request.reference().isBlank()) {
            throw new InvalidRequestException("Missing reference");
        }
        List<BatchItemResult> results = service.verifyBatch(
                AudioSource.fromString(request.reference()), request.candidates(), request.threshold());
        return ResponseEntity.ok(BatchVerifyResponse.from(request.reference(), results));
    }

    @PostMapping(value = "/extract_embedding", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<EmbeddingResponse> extractUpload(@RequestPart("audio") MultipartFile audio) {
        Embedding embedding = service.extract(upload(audio));
        return ResponseEntity.ok(EmbeddingResponse.from(embedding));
    }

    @PostMapping(value = "/extract_embedding", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<EmbeddingResponse> extractJson(@RequestBody ExtractEmbeddingRequest request) {
        Embedding embedding = service.extract(urlOrPath(request.audioUrl(), request.audioPath(), "audio"));
        return ResponseEntity.ok(EmbeddingResponse.from(embedding));
    }

    @PostMapping(value = "/compare_embeddings", consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<CompareEmbeddingsResponse> compareEmbeddings(@RequestBody CompareEmbeddingsRequest request) {
        if (request.embedding1() == null || request.embedding2() == null) {
            throw new InvalidRequestException("Missing embeddings");
        }
        VerificationResult result = service.compareEmbeddings(
                request.embedding1(), request.embedding2(), request.threshold());
        return ResponseEntity.ok(CompareEmbeddingsResponse.from(result));
    }

    private static AudioSource upload(MultipartFile file) {
        return new AudioSource.Upload(file.getOriginalFilename(), file);
    }

    /**
     * Picks the URL or the path for one side of a request; exactly one must be present.
     */
    private static AudioSource urlOrPath(String url, String path, String field) {
        boolean hasUrl = url != null && !url.isBlank();
        boolean hasPath = path != null && !path.isBlank();
        if (hasUrl && hasPath) {
            throw new InvalidRequestException("Provide either " + field + "_url or " + field + "_path, not both");
        }
        if (hasUrl) {
            return new AudioSource.RemoteUrl(url.trim());
        }
        if (hasPath) {
            return new AudioSource.LocalPath(path.trim());
        }
        throw new InvalidRequestException("Missing audio source for " + field + ". Provide a file, URL, or path");
    }
}
