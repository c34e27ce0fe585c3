// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.util.condition;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link Handler.Procedure} receives: the condition, and whether declining it ends in an
 * {@link UnhandledErrorError}.
 */
public record SignaledCondition(@NotNull Condition condition, boolean isFatal) {
}
