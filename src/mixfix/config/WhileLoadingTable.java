package mixfix.config;

import mixfix.errors.Context;
import mixfix.errors.ContextVisitor;

import java.nio.file.Path;

public class WhileLoadingTable extends Context {

	private final Path table;

	public WhileLoadingTable(Path table) {
		this.table = table;
	}

	public Path getTable() {
		return table;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}
}
