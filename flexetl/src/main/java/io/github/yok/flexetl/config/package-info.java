/**
 * Configuration models for FlexETL.
 *
 * <p>
 * Each class binds one section of {@code application.yml} through Spring Boot's
 * {@code @ConfigurationProperties}: store connections, pipeline defaults, source adapter settings
 * and DBUnit write settings.
 * </p>
 */
package io.github.yok.flexetl.config;
