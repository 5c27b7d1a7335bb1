package com.example.docredact.controller;

import com.example.docredact.engine.EngineVariant;
import com.example.docredact.model.DecryptionRequest;
import com.example.docredact.model.RedactedDocument;
import com.example.docredact.model.RestoredDocument;
import com.example.docredact.service.*;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
public class RedactionController {

    public static final String DOCUMENT_ID_HEADER = "X-Document-ID";
    public static final String DECRYPTION_KEY_HEADER = "X-Decryption-Key";

    private final SessionOrchestrator sessionOrchestrator;
    private final DecryptionService decryptionService;
    private final RestorationService restorationService;

    public RedactionController(SessionOrchestrator sessionOrchestrator, DecryptionService decryptionService,
                               RestorationService restorationService) {
        this.sessionOrchestrator = sessionOrchestrator;
        this.decryptionService = decryptionService;
        this.restorationService = restorationService;
    }

    /** Highest accuracy; slower and depends on the remote vision model. */
    @PostMapping(value = {"/redact-llm", "/redact-llm/"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Object>> redactLlm(@RequestPart("file") FilePart file,
                                                  @RequestPart("severity") String severity) {
        return redact(EngineVariant.VISION, file, severity);
    }

    /** Fast, fully local pattern engine. */
    @PostMapping(value = {"/redact-classic", "/redact-classic/"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Object>> redactClassic(@RequestPart("file") FilePart file,
                                                      @RequestPart("severity") String severity) {
        return redact(EngineVariant.RULE_BASED, file, severity);
    }

    @PostMapping(value = {"/decrypt", "/decrypt/"}, consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> decrypt(@RequestBody DecryptionRequest request) {
        return Mono.fromCallable(() -> decryptionService.decrypt(request.getDocumentId(), request.getDecryptionKey()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> result.isSuccess()
                        ? ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body((Object) result.getValue())
                        : errorResponse(result));
    }

    @PostMapping(value = {"/unredact", "/unredact/"}, consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<Object>> unredact(@RequestPart("file") FilePart file,
                                                 @RequestPart("document_id") String documentId,
                                                 @RequestPart("decryption_key") String decryptionKey) {
        return readAll(file)
                .flatMap(bytes -> Mono.fromCallable(() ->
                                restorationService.restore(documentId.trim(), decryptionKey.trim(), file.filename(), bytes))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(result -> {
                    if (!result.isSuccess()) {
                        return errorResponse(result);
                    }
                    RestoredDocument restored = result.getValue();
                    return ResponseEntity.ok()
                            .contentType(MediaType.parseMediaType(restored.getContentType()))
                            .header(HttpHeaders.CONTENT_DISPOSITION, attachment(restored.getFileName()))
                            .body((Object) restored.getContent());
                });
    }

    private Mono<ResponseEntity<Object>> redact(EngineVariant variant, FilePart file, String severityValue) {
        Integer severity = parseSeverity(severityValue);
        if (severity == null) {
            return Mono.just(errorResponse(ServiceResult.failure(ErrorKind.INVALID_REQUEST, "severity must be an integer")));
        }
        return readAll(file)
                .flatMap(bytes -> Mono.fromCallable(() -> sessionOrchestrator.redact(variant, file.filename(), bytes, severity))
                        .subscribeOn(Schedulers.boundedElastic()))
                .map(result -> {
                    if (!result.isSuccess()) {
                        return errorResponse(result);
                    }
                    RedactedDocument document = result.getValue();
                    ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                            .contentType(MediaType.parseMediaType(document.getContentType()))
                            .header(HttpHeaders.CONTENT_DISPOSITION, attachment(document.getFileName()))
                            .header(DOCUMENT_ID_HEADER, document.getDocumentId());
                    if (document.getEncodedKey() != null) {
                        builder.header(DECRYPTION_KEY_HEADER, document.getEncodedKey());
                    }
                    return builder.body((Object) document.getContent());
                });
    }

    private static Mono<byte[]> readAll(FilePart file) {
        return DataBufferUtils.join(file.content())
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0]);
    }

    private static Integer parseSeverity(String value) {
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String attachment(String fileName) {
        return ContentDisposition.attachment().filename(fileName).build().toString();
    }

    static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case SESSION_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_KEY_FORMAT:
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case DECRYPTION_FAILED:
                return HttpStatus.FORBIDDEN;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Object> errorResponse(ServiceResult<?> result) {
        return ResponseEntity.status(statusFor(result.getErrorKind()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(result.errorBody());
    }
}
