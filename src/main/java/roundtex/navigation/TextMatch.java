// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package roundtex.navigation;

/**
 * A regular expression match inside a text leaf.
 *
 * @param text     The matched text.
 * @param position The absolute offset of the match in the parsed source.
 */
public record TextMatch(String text, int position) {
}
