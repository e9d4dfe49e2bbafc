package com.demo.errcode.mysql;

import com.demo.errcode.ErrorCoder;
import io.grpc.Status;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransactionRollbackException;

import static org.junit.jupiter.api.Assertions.*;

class MySqlErrorsTest {

    private final ErrorCoder coder = MySqlErrors.errorCoder();

    private static SQLException mysqlError(int number) {
        return new SQLException("mysql error " + number, "HY000", number);
    }

    @Test
    void testSuccess() {
        assertEquals(Status.Code.OK, coder.errorCode(null));
    }

    @Test
    void testLockWaitTimeout() {
        assertEquals(Status.Code.DEADLINE_EXCEEDED, coder.errorCode(mysqlError(1205)));
    }

    @Test
    void testDeadlock() {
        SQLTransactionRollbackException ex = new SQLTransactionRollbackException(
                "Deadlock found when trying to get lock", "40001", 1213);
        assertEquals(Status.Code.ABORTED, coder.errorCode(ex));
    }

    @Test
    void testAccessDenied() {
        assertEquals(Status.Code.PERMISSION_DENIED, coder.errorCode(mysqlError(1045)));
    }

    @Test
    void testNoSuchTable() {
        SQLSyntaxErrorException ex = new SQLSyntaxErrorException("Table 'db.t' doesn't exist", "42S02", 1146);
        assertEquals(Status.Code.NOT_FOUND, coder.errorCode(ex));
    }

    @Test
    void testFamilies() {
        assertEquals(Status.Code.CANCELLED, MySqlErrors.toGrpc(1317));
        assertEquals(Status.Code.INVALID_ARGUMENT, MySqlErrors.toGrpc(1149));
        assertEquals(Status.Code.ALREADY_EXISTS, MySqlErrors.toGrpc(1050));
        assertEquals(Status.Code.ALREADY_EXISTS, MySqlErrors.toGrpc(1022));
        assertEquals(Status.Code.RESOURCE_EXHAUSTED, MySqlErrors.toGrpc(1040));
        assertEquals(Status.Code.UNIMPLEMENTED, MySqlErrors.toGrpc(1235));
        assertEquals(Status.Code.UNAVAILABLE, MySqlErrors.toGrpc(1053));
        assertEquals(Status.Code.UNAVAILABLE, MySqlErrors.toGrpc(1194));
        assertEquals(Status.Code.UNAUTHENTICATED, MySqlErrors.toGrpc(1131));
        assertEquals(Status.Code.PERMISSION_DENIED, MySqlErrors.toGrpc(13525));
    }

    @Test
    void testUnmappedNumber() {
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(mysqlError(99999)));
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(mysqlError(1062)));
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(mysqlError(0)));
    }

    @Test
    void testWrappedSqlException() {
        RuntimeException ex = new RuntimeException("query failed", mysqlError(1205));
        assertEquals(Status.Code.DEADLINE_EXCEEDED, coder.errorCode(ex));
    }

    @Test
    void testFirstSqlExceptionInChainDecides() {
        SQLException outer = new SQLException("outer", "HY000", 99999, mysqlError(1205));
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(outer));
    }

    @Test
    void testNonSqlException() {
        assertEquals(Status.Code.UNKNOWN, coder.errorCode(new IllegalStateException("test")));
    }
}
