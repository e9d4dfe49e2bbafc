package com.demo.errcode.config;

import com.demo.errcode.ErrorCoder;
import com.demo.errcode.ErrorCoders;
import com.demo.errcode.ErrorCodes;
import com.demo.errcode.googleapi.GoogleApiErrors;
import com.demo.errcode.grpc.GrpcErrors;
import com.demo.errcode.http.HttpErrors;
import com.demo.errcode.mysql.MySqlErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanClassLoaderAware;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Publishes the application-wide {@link ErrorCoder}.
 *
 * Chain order (earlier wins):
 * - explicitly coded errors
 * - gRPC status
 * - HTTP status
 * - Google API client errors (errcode.googleapi.enabled, default true)
 * - timeouts and cancellation
 * - filesystem errors
 * - MySQL server errors (errcode.mysql.enabled, default true), only when a
 *   MySQL or MariaDB JDBC driver is on the classpath
 *
 * The chain is compacted, so coders repeated inside the Google API composite
 * appear once. Declare your own ErrorCoder bean to replace it.
 */
@AutoConfiguration
public class ErrorCoderConfiguration implements BeanClassLoaderAware {
    private static final Logger logger = LoggerFactory.getLogger(ErrorCoderConfiguration.class);

    private ClassLoader beanClassLoader = ClassUtils.getDefaultClassLoader();

    @Override
    public void setBeanClassLoader(ClassLoader classLoader) {
        this.beanClassLoader = classLoader;
    }

    @Bean
    @ConditionalOnMissingBean(ErrorCoder.class)
    public ErrorCoders errorCoder(
            @Value("${errcode.googleapi.enabled:true}") boolean googleApiEnabled,
            @Value("${errcode.mysql.enabled:true}") boolean mysqlEnabled) {
        List<ErrorCoder> coders = new ArrayList<>();
        coders.add(ErrorCodes.codedErrorCoder());
        coders.add(GrpcErrors.errorCoder());
        coders.add(HttpErrors.errorCoder());
        if (googleApiEnabled) {
            coders.add(GoogleApiErrors.errorCoder());
        }
        coders.add(ErrorCodes.contextErrorCoder());
        coders.add(ErrorCodes.fileSystemErrorCoder());
        if (mysqlEnabled) {
            if (isMySqlDriverPresent()) {
                coders.add(MySqlErrors.errorCoder());
            } else {
                logger.info("No MySQL or MariaDB JDBC driver found, leaving out the MySQL error coder");
            }
        }

        ErrorCoders errorCoder = ErrorCoders.compact(coders);
        logger.info("Initializing error coder chain: {}", errorCoder);
        return errorCoder;
    }

    // Vendor numbers from other drivers overlap the MySQL table with different meanings.
    private boolean isMySqlDriverPresent() {
        for (String driver : MySqlErrors.DRIVER_CLASS_NAMES) {
            if (ClassUtils.isPresent(driver, beanClassLoader)) {
                return true;
            }
        }
        return false;
    }
}
