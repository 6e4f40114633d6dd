package com.py2swift.compiler.ast.stmt;

import com.py2swift.compiler.ast.SourceLocation;
import com.py2swift.compiler.ast.StmtVisitor;

import java.util.List;

/**
 * from m import a, b
 */
public class ImportFromStmt extends Statement {
    private final String module;  // 相对导入时可为空
    private final List<Alias> names;
    private final int level;  // 前导点数量

    public ImportFromStmt(SourceLocation location, String module, List<Alias> names, int level) {
        super(location);
        this.module = module;
        this.names = names;
        this.level = level;
    }

    public String getModule() {
        return module;
    }

    public List<Alias> getNames() {
        return names;
    }

    public int getLevel() {
        return level;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitImportFrom(this, context);
    }
}
