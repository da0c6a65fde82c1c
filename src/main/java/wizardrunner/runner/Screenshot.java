package wizardrunner.runner;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * One captured viewport image. {@code data} serializes as base64.
 */
@JsonPropertyOrder({"index", "label", "captured_at", "content_type", "data"})
public final class Screenshot {

    @JsonProperty("index")
    private final int index;

    @JsonProperty("label")
    private final String label;

    @JsonProperty("captured_at")
    private final Instant capturedAt;

    @JsonProperty("content_type")
    private final String contentType;

    @JsonProperty("data")
    private final byte[] data;

    public Screenshot(int index, String label, Instant capturedAt, String contentType, byte[] data) {
        this.index = index;
        this.label = label;
        this.capturedAt = capturedAt;
        this.contentType = contentType;
        this.data = data;
    }

    public int     getIndex()       { return index; }
    public String  getLabel()       { return label; }
    public Instant getCapturedAt()  { return capturedAt; }
    public String  getContentType() { return contentType; }
    public byte[]  getData()        { return data; }

    @Override
    public String toString() {
        return String.format("Screenshot{#%d %s, %s, %d bytes}", index, label, contentType, data.length);
    }
}
