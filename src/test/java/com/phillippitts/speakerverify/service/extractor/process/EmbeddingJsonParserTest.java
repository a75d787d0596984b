package com.phillippitts.speakerverify.service.extractor.process;

import com.phillippitts.speakerverify.service.extractor.process.EmbeddingJsonParser.Kind;
import com.phillippitts.speakerverify.service.extractor.process.EmbeddingJsonParser.WorkerReply;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingJsonParserTest {

    @Test
    void parsesReadyLine() {
        WorkerReply reply = EmbeddingJsonParser.parse("{\"ready\": true, \"dimension\": 192}");

        assertThat(reply.kind()).isEqualTo(Kind.READY);
        assertThat(reply.dimension()).isEqualTo(192);
        assertThat(reply.id()).isEqualTo(EmbeddingJsonParser.NO_ID);
    }

    @Test
    void parsesNotReadyWithError() {
        WorkerReply reply = EmbeddingJsonParser.parse("{\"ready\": false, \"error\": \"model not found\"}");

        assertThat(reply.kind()).isEqualTo(Kind.NOT_READY);
        assertThat(reply.error()).isEqualTo("model not found");
    }

    @Test
    void notReadyWithoutErrorGetsDefaultText() {
        assertThat(EmbeddingJsonParser.parse("{\"ready\": false}").error()).isEqualTo("worker reported not ready");
    }

    @Test
    void parsesEmbeddingWithId() {
        WorkerReply reply = EmbeddingJsonParser.parse("  {\"id\": 7, \"embedding\": [0.5, -0.25, 1]}  ");

        assertThat(reply.kind()).isEqualTo(Kind.EMBEDDING);
        assertThat(reply.id()).isEqualTo(7);
        assertThat(reply.dimension()).isEqualTo(3);
        assertThat(reply.embedding()).containsExactly(0.5, -0.25, 1.0);
    }

    @Test
    void parsesErrorReply() {
        WorkerReply reply = EmbeddingJsonParser.parse("{\"id\": 3, \"error\": \"cannot decode audio\"}");

        assertThat(reply.kind()).isEqualTo(Kind.ERROR);
        assertThat(reply.id()).isEqualTo(3);
        assertThat(reply.error()).isEqualTo("cannot decode audio");
    }

    @Test
    void ignoresNonProtocolLines() {
        assertThat(EmbeddingJsonParser.parse(null)).isNull();
        assertThat(EmbeddingJsonParser.parse("")).isNull();
        assertThat(EmbeddingJsonParser.parse("Downloading model: 100%|#####|")).isNull();
        assertThat(EmbeddingJsonParser.parse("{not json")).isNull();
        assertThat(EmbeddingJsonParser.parse("{\"status\": \"warming up\"}")).isNull();
        assertThat(EmbeddingJsonParser.parse("{\"id\": 1, \"embedding\": [\"x\"]}")).isNull();
    }

    @Test
    void encodesRequestLine() {
        JSONObject request = new JSONObject(EmbeddingJsonParser.request(42, "/tmp/a b.wav"));

        assertThat(request.getLong("id")).isEqualTo(42);
        assertThat(request.getString("audio")).isEqualTo("/tmp/a b.wav");
    }
}
