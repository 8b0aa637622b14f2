/**
 * Steps chained by type in workflow tests. Public so the step registry can construct them.
 */
package com.ryuqq.railway.core.workflow.fixture;
