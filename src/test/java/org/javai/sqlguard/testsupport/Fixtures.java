package org.javai.sqlguard.testsupport;

import java.util.List;
import java.util.Map;
import org.javai.sqlguard.catalog.InMemorySchemaCatalog;
import org.javai.sqlguard.catalog.SchemaCatalog;
import org.javai.sqlguard.config.GuardConfig;
import org.javai.sqlguard.identity.Identity;
import org.javai.sqlguard.policy.RbacPolicy;
import org.javai.sqlguard.policy.RlsPolicy;
import org.javai.sqlguard.policy.SensitiveColumns;

/**
 * A small order-management schema shared by the tests, mirrored in {@link TestDatabase}.
 *
 * <ul>
 *   <li>{@code customer} may read only {@code orders(id, total)};</li>
 *   <li>{@code employee} reads orders and customers and is row-filtered on
 *       {@code orders.employee_id};</li>
 *   <li>{@code admin} reads everything.</li>
 * </ul>
 */
public final class Fixtures {

	private Fixtures() {
	}

	public static SchemaCatalog catalog() {
		return InMemorySchemaCatalog.builder()
				.addTable("customers", "id", "name", "email", "region")
				.addTable("employees", "id", "name", "salary", "region")
				.addTable("orders", "id", "customer_id", "employee_id", "total", "status")
				.addTable("invoices", "id", "order_id", "total")
				.addRelationship("orders", "customer_id", "customers", "id")
				.addRelationship("orders", "employee_id", "employees", "id")
				.addRelationship("invoices", "order_id", "orders", "id")
				.build();
	}

	public static RbacPolicy rbac() {
		return RbacPolicy.of(Map.of(
				"customer", Map.of("orders", List.of("id", "total")),
				"employee", Map.of(
						"orders", List.of("id", "customer_id", "employee_id", "total", "status"),
						"customers", List.of("id", "name", "region")),
				"admin", Map.of(
						"customers", List.of("id", "name", "email", "region"),
						"employees", List.of("id", "name", "salary", "region"),
						"orders", List.of("id", "customer_id", "employee_id", "total", "status"),
						"invoices", List.of("id", "order_id", "total"))));
	}

	public static RlsPolicy rls() {
		return RlsPolicy.of(Map.of(
				"employee", "orders.employee_id = {user_id}",
				"customer", "orders.customer_id = {user_id}"));
	}

	public static SensitiveColumns sensitiveColumns() {
		return SensitiveColumns.of(Map.of(
				"customers", List.of("email"),
				"employees", List.of("salary"),
				"orders", List.of("customer_id")));
	}

	public static GuardConfig config() {
		return GuardConfig.builder()
				.rbac(rbac())
				.rls(rls())
				.sensitiveColumns(sensitiveColumns())
				.build();
	}

	public static Identity customer() {
		return Identity.of("customer", 1, "Carla");
	}

	public static Identity employee() {
		return Identity.of("employee", 8, "Eddie");
	}

	public static Identity admin() {
		return Identity.of("admin", 1, "Maggie");
	}
}
