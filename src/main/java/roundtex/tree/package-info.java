// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The lossless expression tree: text leaves, commands, environments and argument groups, and the serializer that
 * turns a tree back into source text.
 */
@NonNullByDefault
package roundtex.tree;

import roundtex.util.annotation.NonNullByDefault;
