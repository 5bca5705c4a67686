/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.goast.ast;

import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr.Ident;
import ru.nts.tools.goast.ast.Spec.ImportSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * Разобранный модуль (файл Go): пакет и объявления в порядке исходника.
 * Импорты хранятся как {@link GenDecl} с {@code tok = "import"}.
 */
public record GoFile(Ident packageName, List<Decl> decls, Span span) implements Node {

    public GoFile {
        decls = List.copyOf(decls);
    }

    public GoFile(String packageName, List<Decl> decls) {
        this(new Ident(packageName), decls, Span.NONE);
    }

    /**
     * Все спецификации импорта в порядке объявления.
     */
    public List<ImportSpec> imports() {
        List<ImportSpec> result = new ArrayList<>();
        for (Decl decl : decls) {
            if (decl instanceof GenDecl gen && "import".equals(gen.tok())) {
                for (Spec spec : gen.specs()) {
                    if (spec instanceof ImportSpec imp) {
                        result.add(imp);
                    }
                }
            }
        }
        return result;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitGoFile(this);
    }
}
