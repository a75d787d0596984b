package com.phillippitts.speakerverify.service.extractor.process;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses the line-delimited JSON the embedding worker writes to stdout.
 *
 * <p>Recognized shapes:
 * <pre>
 * {"ready": true, "dimension": 192}
 * {"ready": false, "error": "model not found"}
 * {"id": 7, "embedding": [0.01, -0.2, ...]}
 * {"id": 7, "error": "cannot decode audio"}
 * </pre>
 *
 * <p>Anything that is not a JSON object (library banners, progress bars) yields {@code null}.
 */
final class EmbeddingJsonParser {

    static final long NO_ID = -1L;

    enum Kind { READY, NOT_READY, EMBEDDING, ERROR }

    /**
     * One decoded worker line.
     *
     * @param kind      message type
     * @param id        request id echoed by the worker, or {@link #NO_ID}
     * @param dimension embedding length (READY and EMBEDDING)
     * @param embedding raw vector (EMBEDDING only)
     * @param error     worker error text (NOT_READY and ERROR)
     */
    record WorkerReply(Kind kind, long id, int dimension, double[] embedding, String error) {
    }

    private EmbeddingJsonParser() {}

    /**
     * Parses a single stdout line.
     *
     * @param line raw line (may be null)
     * @return decoded reply, or {@code null} when the line is not a protocol message
     */
    static WorkerReply parse(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.trim();
        if (!trimmed.startsWith("{")) {
            return null;
        }
        try {
            JSONObject obj = new JSONObject(trimmed);
            long id = obj.has("id") && !obj.isNull("id") ? obj.getLong("id") : NO_ID;
            String error = obj.has("error") && !obj.isNull("error") ? String.valueOf(obj.get("error")) : null;

            if (obj.has("ready")) {
                if (obj.optBoolean("ready", false)) {
                    return new WorkerReply(Kind.READY, id, obj.optInt("dimension", 0), null, null);
                }
                return new WorkerReply(Kind.NOT_READY, id, 0, null,
                        error != null ? error : "worker reported not ready");
            }

            JSONArray arr = obj.optJSONArray("embedding");
            if (arr != null) {
                double[] embedding = new double[arr.length()];
                for (int i = 0; i < arr.length(); i++) {
                    embedding[i] = arr.getDouble(i);
                }
                return new WorkerReply(Kind.EMBEDDING, id, embedding.length, embedding, null);
            }
            if (error != null) {
                return new WorkerReply(Kind.ERROR, id, 0, null, error);
            }
            return null;
        } catch (JSONException e) {
            return null;
        }
    }

    /**
     * Encodes an extraction request line (without the trailing newline).
     */
    static String request(long id, String audioPath) {
        return new JSONObject().put("id", id).put("audio", audioPath).toString();
    }
}
