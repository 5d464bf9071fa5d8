package com.blueprintbridge.transpiler.flow;

import com.blueprintbridge.transpiler.flow.Expression.*;

public interface ExpressionVisitor<R> {
    R visitLiteral(Literal literal);
    R visitVariable(VariableRef variable);
    R visitParameter(ParameterRef parameter);
    R visitSelf(SelfRef self);
    R visitCall(CallExpression call);
    R visitOperator(OperatorExpression operator);
    R visitTemporary(TemporaryRef temporary);
    R visitLoopVariable(LoopVariableRef loopVariable);
    R visitZero(ZeroValue zero);
    R visitUnresolved(Unresolved unresolved);
}
