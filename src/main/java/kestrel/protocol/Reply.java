package kestrel.protocol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A reply produced by a command. Each variant knows its wire encoding.
 */
public abstract class Reply {

    private static final Reply NULL_BULK = new NullBulk();

    public abstract byte[] toResp();

    public static Reply status(String status) {
        return new SimpleStatus(status);
    }

    public static Reply bulk(String value) {
        return new Bulk(value);
    }

    public static Reply nullBulk() {
        return NULL_BULK;
    }

    public static Reply array(List<String> elements) {
        return new Array(elements);
    }

    public static Reply error(String message) {
        return new Error(message);
    }

    public static final class SimpleStatus extends Reply {
        private final String status;

        SimpleStatus(String status) {
            this.status = status;
        }

        public String getStatus() {
            return status;
        }

        @Override
        public byte[] toResp() {
            return Resp.simpleString(status);
        }
    }

    public static final class Bulk extends Reply {
        private final String value;

        Bulk(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public byte[] toResp() {
            return Resp.bulkString(value);
        }
    }

    public static final class NullBulk extends Reply {
        private NullBulk() {
        }

        @Override
        public byte[] toResp() {
            return Resp.nullBulkString();
        }
    }

    public static final class Array extends Reply {
        private final List<String> elements;

        Array(List<String> elements) {
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public List<String> getElements() {
            return elements;
        }

        @Override
        public byte[] toResp() {
            return Resp.array(elements);
        }
    }

    public static final class Error extends Reply {
        private final String message;

        Error(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public byte[] toResp() {
            return Resp.error(message);
        }
    }
}
