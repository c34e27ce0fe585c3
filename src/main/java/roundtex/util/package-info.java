// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Small general-purpose utilities.
 */
@NonNullByDefault
package roundtex.util;

import roundtex.util.annotation.NonNullByDefault;
