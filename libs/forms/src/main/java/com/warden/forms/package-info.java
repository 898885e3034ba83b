/**
 * Form validation and error projection.
 *
 * <p>A {@link com.warden.forms.FormDescriptor} lists a form's fields with their form keys and
 * binding rules ({@code Required;AlphaDashDot;MaxSize(35)}). {@link
 * com.warden.forms.FormValidator} checks a submitted form against it, and {@link
 * com.warden.forms.FormProjection} turns the first error into the {@code HasError}, {@code
 * Err_<Field>} and {@code ErrorMsg} template values, translated through a Spring {@code
 * MessageSource}.
 */
package com.warden.forms;
