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

import ru.nts.tools.goast.ast.Decl.FuncDecl;
import ru.nts.tools.goast.ast.Decl.GenDecl;
import ru.nts.tools.goast.ast.Expr.*;
import ru.nts.tools.goast.ast.Spec.ImportSpec;
import ru.nts.tools.goast.ast.Spec.TypeSpec;
import ru.nts.tools.goast.ast.Spec.ValueSpec;
import ru.nts.tools.goast.ast.Stmt.*;

/**
 * Посетитель узлов: по одному методу на каждый вариант.
 * Добавление варианта узла требует реализации во всех посетителях.
 */
public interface NodeVisitor<R> {

    R visitGoFile(GoFile node);

    R visitFuncDecl(FuncDecl node);

    R visitGenDecl(GenDecl node);

    R visitImportSpec(ImportSpec node);

    R visitValueSpec(ValueSpec node);

    R visitTypeSpec(TypeSpec node);

    R visitField(Field node);

    R visitFieldList(FieldList node);

    R visitCaseClause(CaseClause node);

    R visitCommClause(CommClause node);

    // Выражения и типы

    R visitIdent(Ident node);

    R visitBasicLit(BasicLit node);

    R visitSelectorExpr(SelectorExpr node);

    R visitCallExpr(CallExpr node);

    R visitCompositeLit(CompositeLit node);

    R visitKeyValueExpr(KeyValueExpr node);

    R visitUnaryExpr(UnaryExpr node);

    R visitBinaryExpr(BinaryExpr node);

    R visitParenExpr(ParenExpr node);

    R visitStarExpr(StarExpr node);

    R visitIndexExpr(IndexExpr node);

    R visitSliceExpr(SliceExpr node);

    R visitTypeAssertExpr(TypeAssertExpr node);

    R visitArrayType(ArrayType node);

    R visitMapType(MapType node);

    R visitChanType(ChanType node);

    R visitFuncType(FuncType node);

    R visitStructType(StructType node);

    R visitInterfaceType(InterfaceType node);

    R visitEllipsis(Ellipsis node);

    R visitFuncLit(FuncLit node);

    R visitRawExpr(RawExpr node);

    // Операторы

    R visitBlockStmt(BlockStmt node);

    R visitExprStmt(ExprStmt node);

    R visitAssignStmt(AssignStmt node);

    R visitIncDecStmt(IncDecStmt node);

    R visitReturnStmt(ReturnStmt node);

    R visitIfStmt(IfStmt node);

    R visitForStmt(ForStmt node);

    R visitRangeStmt(RangeStmt node);

    R visitSwitchStmt(SwitchStmt node);

    R visitTypeSwitchStmt(TypeSwitchStmt node);

    R visitSelectStmt(SelectStmt node);

    R visitDeclStmt(DeclStmt node);

    R visitGoStmt(GoStmt node);

    R visitDeferStmt(DeferStmt node);

    R visitBranchStmt(BranchStmt node);

    R visitSendStmt(SendStmt node);

    R visitLabeledStmt(LabeledStmt node);

    R visitRawStmt(RawStmt node);
}
