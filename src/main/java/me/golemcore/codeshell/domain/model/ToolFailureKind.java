package me.golemcore.codeshell.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Machine-readable classification of a failed tool invocation. Carried on
 * {@link ToolResult} so the model and the panes can tell failures apart
 * without parsing error text.
 */
public enum ToolFailureKind {

    /** Arguments did not match the tool's input schema or could not be parsed. */
    VALIDATION_FAILED,

    /** The handler threw, or the process exited with a non-zero code. */
    EXECUTION_FAILED,

    /** The tool's remote server is unreachable or being removed. */
    TOOL_UNAVAILABLE,

    /** A path escaped the working root or the operation is blocked. */
    ACCESS_DENIED,

    TIMED_OUT,

    /** The owning run was cancelled before or during execution. */
    CANCELLED,

    /** No tool with the requested name is registered. */
    NOT_FOUND
}
