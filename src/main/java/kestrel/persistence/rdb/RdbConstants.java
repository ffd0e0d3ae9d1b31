package kestrel.persistence.rdb;

public class RdbConstants {
    // Header
    public static final String RDB_MAGIC = "REDIS";
    public static final int RDB_VERSION_LENGTH = 4;
    public static final int RDB_HEADER_LENGTH = 9;

    // OpCodes
    public static final int RDB_OPCODE_EOF = 0xFF;
    public static final int RDB_OPCODE_SELECTDB = 0xFE;
    public static final int RDB_OPCODE_EXPIRETIME = 0xFD;
    public static final int RDB_OPCODE_EXPIRETIME_MS = 0xFC;
    public static final int RDB_OPCODE_RESIZEDB = 0xFB;
    public static final int RDB_OPCODE_AUX = 0xFA;

    // Value types
    public static final int RDB_TYPE_STRING = 0;

    // Length encodings, selected by the top two bits of the control byte
    public static final int RDB_6BITLEN = 0;
    public static final int RDB_14BITLEN = 1;
    public static final int RDB_32BITLEN = 2;
    public static final int RDB_ENCVAL = 3;

    // Special string encodings (control byte when the top bits are RDB_ENCVAL)
    public static final int RDB_ENC_INT8 = 0xC0;
    public static final int RDB_ENC_INT16 = 0xC1;
    public static final int RDB_ENC_INT32 = 0xC2;
    public static final int RDB_ENC_LZF = 0xC3;

    // Largest key the reader will materialize; matches the server's default proto-max-bulk-len
    public static final int RDB_MAX_STRING_LENGTH = 512 * 1024 * 1024;
}
