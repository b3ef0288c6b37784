package org.javai.sqlguard.config;

import java.util.List;
import java.util.Objects;
import org.javai.sqlguard.policy.RbacPolicy;
import org.javai.sqlguard.policy.RlsPolicy;
import org.javai.sqlguard.policy.SensitiveColumns;
import org.javai.sqlguard.screen.InjectionScreener;

/**
 * The complete, immutable guard configuration.
 *
 * <p>Built once at startup (normally by {@link GuardConfigLoader}) and passed by reference to
 * the components that need it. Nothing mutates it afterwards.</p>
 *
 * @param database connection settings; may be null when the caller supplies its own data source
 * @param rbac role → table → column allow-lists
 * @param rls role → row filter templates
 * @param injectionPatterns ordered regular expressions rejected by the injection screener
 * @param sensitiveColumns columns whose reads are audited
 * @param unqualifiedColumns authorization rule for unqualified column references
 * @param generator language-model settings
 */
public record GuardConfig(
		DatabaseSettings database,
		RbacPolicy rbac,
		RlsPolicy rls,
		List<String> injectionPatterns,
		SensitiveColumns sensitiveColumns,
		UnqualifiedColumnPolicy unqualifiedColumns,
		GeneratorSettings generator
) {

	public GuardConfig {
		Objects.requireNonNull(rbac, "rbac must not be null");
		rls = rls != null ? rls : RlsPolicy.empty();
		injectionPatterns = injectionPatterns != null ? List.copyOf(injectionPatterns) : InjectionScreener.DEFAULT_PATTERNS;
		sensitiveColumns = sensitiveColumns != null ? sensitiveColumns : SensitiveColumns.none();
		unqualifiedColumns = unqualifiedColumns != null ? unqualifiedColumns : UnqualifiedColumnPolicy.ANY_ALLOWED_TABLE;
		generator = generator != null ? generator : GeneratorSettings.defaults();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static final class Builder {
		private DatabaseSettings database;
		private RbacPolicy rbac = RbacPolicy.empty();
		private RlsPolicy rls = RlsPolicy.empty();
		private List<String> injectionPatterns = InjectionScreener.DEFAULT_PATTERNS;
		private SensitiveColumns sensitiveColumns = SensitiveColumns.none();
		private UnqualifiedColumnPolicy unqualifiedColumns = UnqualifiedColumnPolicy.ANY_ALLOWED_TABLE;
		private GeneratorSettings generator = GeneratorSettings.defaults();

		private Builder() {
		}

		public Builder database(DatabaseSettings database) {
			this.database = database;
			return this;
		}

		public Builder rbac(RbacPolicy rbac) {
			this.rbac = rbac;
			return this;
		}

		public Builder rls(RlsPolicy rls) {
			this.rls = rls;
			return this;
		}

		public Builder injectionPatterns(List<String> injectionPatterns) {
			this.injectionPatterns = injectionPatterns;
			return this;
		}

		public Builder sensitiveColumns(SensitiveColumns sensitiveColumns) {
			this.sensitiveColumns = sensitiveColumns;
			return this;
		}

		public Builder unqualifiedColumns(UnqualifiedColumnPolicy unqualifiedColumns) {
			this.unqualifiedColumns = unqualifiedColumns;
			return this;
		}

		public Builder generator(GeneratorSettings generator) {
			this.generator = generator;
			return this;
		}

		public GuardConfig build() {
			return new GuardConfig(database, rbac, rls, injectionPatterns, sensitiveColumns, unqualifiedColumns, generator);
		}
	}
}
