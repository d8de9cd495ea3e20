package my.teampricing.app.config;

import liquibase.integration.spring.SpringLiquibase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.beans.factory.config.BeanFactoryPostProcessor;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.support.DatabaseStartupValidator;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(DatabaseConfig.SchemaSettings.class)
public class DatabaseConfig {
	private static final Logger logger = LoggerFactory.getLogger(DatabaseConfig.class);

	static final String DEFAULT_CHANGE_LOG = "classpath:db/changelog/db.changelog-master.yaml";
	static final int DEFAULT_STARTUP_TIMEOUT_SECONDS = 60;
	static final int DEFAULT_STARTUP_INTERVAL_SECONDS = 5;

	@Bean
	public DatabaseStartupValidator databaseStartupValidator(DataSource dataSource, SchemaSettings settings) {
		DatabaseStartupValidator validator = new DatabaseStartupValidator();
		validator.setDataSource(dataSource);
		validator.setTimeout(settings.resolvedStartupTimeoutSeconds());
		validator.setInterval(settings.resolvedStartupIntervalSeconds());
		return validator;
	}

	@Bean
	@DependsOn("databaseStartupValidator")
	public SpringLiquibase liquibase(DataSource dataSource, SchemaSettings settings) {
		SpringLiquibase liquibase = new SpringLiquibase();
		liquibase.setDataSource(dataSource);
		liquibase.setChangeLog(settings.resolvedChangeLog());
		liquibase.setShouldRun(settings.resolvedMigrate());
		logger.info("Pricing schema changelog {} (migrate={}).", settings.resolvedChangeLog(), settings.resolvedMigrate());
		return liquibase;
	}

	/**
	 * JPA must not start before the pricing tables exist.
	 */
	@Bean
	public static BeanFactoryPostProcessor schemaBeforeJpaPostProcessor() {
		return beanFactory -> {
			addDependsOn(beanFactory, "entityManagerFactory", "liquibase");
			addDependsOn(beanFactory, "jpaSharedEM_entityManagerFactory", "liquibase");
		};
	}

	static void addDependsOn(ConfigurableListableBeanFactory beanFactory, String beanName, String dependency) {
		if (!beanFactory.containsBeanDefinition(beanName)) {
			return;
		}
		BeanDefinition definition = beanFactory.getBeanDefinition(beanName);
		Set<String> dependsOn = new LinkedHashSet<>();
		if (definition.getDependsOn() != null) {
			dependsOn.addAll(Arrays.asList(definition.getDependsOn()));
		}
		dependsOn.add(dependency);
		definition.setDependsOn(dependsOn.toArray(new String[0]));
	}

	@ConfigurationProperties(prefix = "app.database")
	public record SchemaSettings(
			String changeLog,
			Boolean migrate,
			Integer startupTimeoutSeconds,
			Integer startupIntervalSeconds
	) {
		String resolvedChangeLog() {
			return changeLog == null || changeLog.isBlank() ? DEFAULT_CHANGE_LOG : changeLog;
		}

		boolean resolvedMigrate() {
			return migrate == null || migrate;
		}

		int resolvedStartupTimeoutSeconds() {
			return startupTimeoutSeconds == null ? DEFAULT_STARTUP_TIMEOUT_SECONDS : Math.max(1, startupTimeoutSeconds);
		}

		int resolvedStartupIntervalSeconds() {
			return startupIntervalSeconds == null ? DEFAULT_STARTUP_INTERVAL_SECONDS : Math.max(1, startupIntervalSeconds);
		}
	}
}
