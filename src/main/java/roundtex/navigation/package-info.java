// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The navigation, search and mutation facade over parsed documents.
 */
@NonNullByDefault
package roundtex.navigation;

import roundtex.util.annotation.NonNullByDefault;
