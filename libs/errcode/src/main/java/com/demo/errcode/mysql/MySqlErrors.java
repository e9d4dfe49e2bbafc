package com.demo.errcode.mysql;

import com.demo.errcode.Causes;
import com.demo.errcode.ErrorCoder;
import com.demo.errcode.ErrorCoders;
import io.grpc.Status;
import org.springframework.lang.Nullable;

import java.sql.SQLException;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Extracts the status code from MySQL server errors.
 *
 * MySQL Connector/J reports the server error number as the vendor code of the
 * {@link SQLException} ({@link SQLException#getErrorCode()}).
 *
 * The vendor code is assumed to be a MySQL server error number. Other drivers use
 * overlapping numbers with different meanings (SQL Server 1205 is a deadlock victim,
 * Oracle 1017 a logon failure), so only add this coder to a chain when the
 * application talks to MySQL or MariaDB.
 *
 * SEE: https://dev.mysql.com/doc/mysql-errors/8.0/en/server-error-reference.html
 */
public final class MySqlErrors {

    private static final ErrorCoder ERROR_CODER = ErrorCoders.fromFunction("mysql", MySqlErrors::errorCode);

    /**
     * JDBC drivers whose vendor codes are MySQL server error numbers.
     */
    public static final List<String> DRIVER_CLASS_NAMES = List.of(
            "com.mysql.cj.jdbc.Driver",
            "com.mysql.jdbc.Driver",
            "org.mariadb.jdbc.Driver");

    private static final Map<Integer, Status.Code> MYSQL_CODES;

    static {
        Map<Integer, Status.Code> codes = new HashMap<>();

        codes.put(1317, Status.Code.CANCELLED); // ER_QUERY_INTERRUPTED

        codes.put(1149, Status.Code.INVALID_ARGUMENT); // ER_SYNTAX_ERROR

        codes.put(1205, Status.Code.DEADLINE_EXCEEDED); // ER_LOCK_WAIT_TIMEOUT

        codes.put(1008, Status.Code.NOT_FOUND); // ER_DB_DROP_EXISTS
        codes.put(1017, Status.Code.NOT_FOUND); // ER_FILE_NOT_FOUND
        codes.put(1031, Status.Code.NOT_FOUND); // ER_KEY_NOT_FOUND
        codes.put(1049, Status.Code.NOT_FOUND); // ER_BAD_DB_ERROR
        codes.put(1051, Status.Code.NOT_FOUND); // ER_BAD_TABLE_ERROR
        codes.put(1106, Status.Code.NOT_FOUND); // ER_UNKNOWN_PROCEDURE
        codes.put(1109, Status.Code.NOT_FOUND); // ER_UNKNOWN_TABLE
        codes.put(1133, Status.Code.NOT_FOUND); // ER_PASSWORD_NO_MATCH
        codes.put(1146, Status.Code.NOT_FOUND); // ER_NO_SUCH_TABLE
        codes.put(1176, Status.Code.NOT_FOUND); // ER_KEY_DOES_NOT_EXITS
        codes.put(1305, Status.Code.NOT_FOUND); // ER_SP_DOES_NOT_EXIST

        codes.put(1007, Status.Code.ALREADY_EXISTS); // ER_DB_CREATE_EXISTS
        codes.put(1022, Status.Code.ALREADY_EXISTS); // ER_DUP_KEY
        codes.put(1050, Status.Code.ALREADY_EXISTS); // ER_TABLE_EXISTS_ERROR
        codes.put(1086, Status.Code.ALREADY_EXISTS); // ER_FILE_EXISTS_ERROR
        codes.put(1169, Status.Code.ALREADY_EXISTS); // ER_DUP_UNIQUE
        codes.put(1304, Status.Code.ALREADY_EXISTS); // ER_SP_ALREADY_EXISTS

        codes.put(1044, Status.Code.PERMISSION_DENIED); // ER_DBACCESS_DENIED_ERROR
        codes.put(1045, Status.Code.PERMISSION_DENIED); // ER_ACCESS_DENIED_ERROR
        codes.put(1130, Status.Code.PERMISSION_DENIED); // ER_HOST_NOT_PRIVILEGED
        codes.put(1132, Status.Code.PERMISSION_DENIED); // ER_PASSWORD_NOT_ALLOWED
        codes.put(1142, Status.Code.PERMISSION_DENIED); // ER_TABLEACCESS_DENIED_ERROR
        codes.put(1143, Status.Code.PERMISSION_DENIED); // ER_COLUMNACCESS_DENIED_ERROR
        codes.put(1227, Status.Code.PERMISSION_DENIED); // ER_SPECIFIC_ACCESS_DENIED_ERROR
        codes.put(1698, Status.Code.PERMISSION_DENIED); // ER_ACCESS_DENIED_NO_PASSWORD_ERROR
        codes.put(3118, Status.Code.PERMISSION_DENIED); // ER_ACCOUNT_HAS_BEEN_LOCKED
        codes.put(3879, Status.Code.PERMISSION_DENIED); // ER_DB_ACCESS_DENIED
        codes.put(3955, Status.Code.PERMISSION_DENIED); // ER_USER_ACCESS_DENIED_FOR_USER_ACCOUNT_BLOCKED_BY_PASSWORD_LOCK
        codes.put(10926, Status.Code.PERMISSION_DENIED); // ER_ACCESS_DENIED_ERROR_WITH_PASSWORD
        codes.put(10927, Status.Code.PERMISSION_DENIED); // ER_ACCESS_DENIED_FOR_USER_ACCOUNT_LOCKED
        codes.put(11192, Status.Code.PERMISSION_DENIED); // ER_FIREWALL_ACCESS_DENIED
        codes.put(13525, Status.Code.PERMISSION_DENIED); // ER_ACCESS_DENIED_FOR_USER_ACCOUNT_BLOCKED_BY_PASSWORD_LOCK

        codes.put(1037, Status.Code.RESOURCE_EXHAUSTED); // ER_OUTOFMEMORY
        codes.put(1038, Status.Code.RESOURCE_EXHAUSTED); // ER_OUT_OF_SORTMEMORY
        codes.put(1040, Status.Code.RESOURCE_EXHAUSTED); // ER_CON_COUNT_ERROR
        codes.put(1041, Status.Code.RESOURCE_EXHAUSTED); // ER_OUT_OF_RESOURCES
        codes.put(1129, Status.Code.RESOURCE_EXHAUSTED); // ER_HOST_IS_BLOCKED
        codes.put(1197, Status.Code.RESOURCE_EXHAUSTED); // ER_TRANS_CACHE_FULL
        codes.put(1203, Status.Code.RESOURCE_EXHAUSTED); // ER_TOO_MANY_USER_CONNECTIONS
        codes.put(1206, Status.Code.RESOURCE_EXHAUSTED); // ER_LOCK_TABLE_FULL
        codes.put(1226, Status.Code.RESOURCE_EXHAUSTED); // ER_USER_LIMIT_REACHED
        codes.put(1461, Status.Code.RESOURCE_EXHAUSTED); // ER_MAX_PREPARED_STMT_COUNT_REACHED

        codes.put(1213, Status.Code.ABORTED); // ER_LOCK_DEADLOCK

        codes.put(1148, Status.Code.UNIMPLEMENTED); // ER_NOT_ALLOWED_COMMAND
        codes.put(1178, Status.Code.UNIMPLEMENTED); // ER_CHECK_NOT_IMPLEMENTED
        codes.put(1235, Status.Code.UNIMPLEMENTED); // ER_NOT_SUPPORTED_YET
        codes.put(1295, Status.Code.UNIMPLEMENTED); // ER_UNSUPPORTED_PS

        codes.put(1053, Status.Code.UNAVAILABLE); // ER_SERVER_SHUTDOWN
        codes.put(1077, Status.Code.UNAVAILABLE); // ER_NORMAL_SHUTDOWN
        codes.put(1079, Status.Code.UNAVAILABLE); // ER_SHUTDOWN_COMPLETE
        codes.put(1080, Status.Code.UNAVAILABLE); // ER_FORCING_CLOSE
        codes.put(1194, Status.Code.UNAVAILABLE); // ER_CRASHED_ON_USAGE
        codes.put(1195, Status.Code.UNAVAILABLE); // ER_CRASHED_ON_REPAIR

        codes.put(1131, Status.Code.UNAUTHENTICATED); // ER_PASSWORD_ANONYMOUS_USER

        MYSQL_CODES = Collections.unmodifiableMap(codes);
    }

    private MySqlErrors() {
    }

    /**
     * Returns the MySQL ErrorCoder.
     */
    public static ErrorCoder errorCoder() {
        return ERROR_CODER;
    }

    /**
     * Returns the gRPC code associated with the given error
     * if its cause chain contains a {@link SQLException}.
     */
    public static Status.Code errorCode(@Nullable Throwable error) {
        if (error == null) {
            return Status.Code.OK;
        }
        return Causes.find(error, SQLException.class)
                .map(e -> toGrpc(e.getErrorCode()))
                .orElse(Status.Code.UNKNOWN);
    }

    /**
     * Returns the gRPC code for a MySQL server error number, UNKNOWN if unmapped.
     */
    public static Status.Code toGrpc(int errorNumber) {
        return MYSQL_CODES.getOrDefault(errorNumber, Status.Code.UNKNOWN);
    }
}
