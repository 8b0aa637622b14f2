/**
 * Workflow registration and input-type based dispatch.
 */
package com.ryuqq.railway.application.registry;
