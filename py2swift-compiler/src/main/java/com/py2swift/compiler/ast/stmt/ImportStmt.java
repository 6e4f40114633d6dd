package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

import java.util.List;

/**
 * import a.b [as c]
 */
public class ImportStmt extends Statement {
    private final List<Alias> names;

    public ImportStmt(SourceLocation location, List<Alias> names) {
        super(location);
        this.names = names;
    }

    public List<Alias> getNames() {
        return names;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitImport(this, context);
    }
}
