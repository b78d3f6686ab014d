package com.questrail.bincodec.config;

import com.questrail.bincodec.api.ByteOrder;
import com.questrail.bincodec.observability.CodecObservabilitySink;
import com.questrail.bincodec.observability.NullObservabilitySink;
import com.questrail.bincodec.platform.HostByteOrder;

import java.util.Objects;

/**
 * Configuration shared by codec instances.
 *
 * <p>{@code defaultOrder} is used by the codec operations that take no
 * explicit {@link ByteOrder}.</p>
 */
public record CodecConfig(
    ByteOrder defaultOrder,
    CodecObservabilitySink observabilitySink
) {
    private static final CodecConfig DEFAULTS = builder().build();

    public CodecConfig {
        Objects.requireNonNull(defaultOrder, "defaultOrder");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static CodecConfig defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ByteOrder defaultOrder = ByteOrder.LITTLE_ENDIAN;
        private CodecObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withDefaultOrder(ByteOrder defaultOrder) {
            this.defaultOrder = defaultOrder;
            return this;
        }

        public Builder withHostDefaultOrder() {
            this.defaultOrder = HostByteOrder.get();
            return this;
        }

        public Builder withObservabilitySink(CodecObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public CodecConfig build() {
            return new CodecConfig(defaultOrder, observabilitySink);
        }
    }
}
